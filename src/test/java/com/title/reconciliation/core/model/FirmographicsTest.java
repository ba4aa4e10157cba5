package com.title.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FirmographicsTest {

    @Test
    @DisplayName("Newer non-blank fields win, missing ones are kept")
    void testOverlay() {
        Firmographics older = Firmographics.builder()
                .name("Acme")
                .industry("Software")
                .employeeCount(200)
                .headquartersLocation("Austin, TX")
                .build();
        Firmographics newer = Firmographics.builder()
                .name("Acme, Inc.")
                .industry(" ")
                .employeeCount(250)
                .build();

        Firmographics merged = older.overlay(newer);

        assertEquals("Acme, Inc.", merged.name());
        assertEquals("Software", merged.industry());
        assertEquals(250, merged.employeeCount());
        assertEquals("Austin, TX", merged.headquartersLocation());
        assertNull(merged.domain());
    }

    @Test
    @DisplayName("Overlaying null changes nothing")
    void testOverlayNull() {
        Firmographics firmographics = Firmographics.builder().name("Acme").build();

        assertSame(firmographics, firmographics.overlay(null));
    }

    @Test
    @DisplayName("Should detect empty firmographics")
    void testEmpty() {
        assertTrue(Firmographics.empty().isEmpty());
        assertTrue(Firmographics.builder().build().isEmpty());
        assertFalse(Firmographics.builder().revenueRange("$1M-$10M").build().isEmpty());
    }
}

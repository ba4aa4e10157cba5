package com.title.reconciliation.trigger;

import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionMode;
import com.title.reconciliation.core.model.TriggerScenario;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TriggerClassifierTest {

    private final TriggerClassifier classifier = new TriggerClassifier();

    private static PersonRecord record(String titleInput, String titleNew) {
        return PersonRecord.builder()
                .personId("p1")
                .titleInput(titleInput)
                .titleNew(titleNew)
                .build();
    }

    @ParameterizedTest
    @DisplayName("Should classify title pairs")
    @CsvSource(value = {
            "NULL,VP of Sales,NEW_TITLE_AVAILABLE",
            "'   ',VP of Sales,NEW_TITLE_AVAILABLE",
            "Manager,Sr. Manager,TITLE_COLLISION",
            "Manager,Manager,NO_TRIGGER",
            "manager,MANAGER,NO_TRIGGER",
            "Vice  President,vice president,NO_TRIGGER",
            "Manager,NULL,NO_TRIGGER",
            "NULL,NULL,NO_TRIGGER",
            "NULL,'  ',NO_TRIGGER"
    }, nullValues = "NULL")
    void testClassification(String titleInput, String titleNew, TriggerScenario expected) {
        assertEquals(expected, classifier.classify(record(titleInput, titleNew)).scenario());
    }

    @Test
    @DisplayName("Scenario A extrapolates")
    void testNewTitleMode() {
        TriggerClassification classification = classifier.classify(record(null, "VP of Sales"));

        assertTrue(classification.requiresResolution());
        assertEquals(ResolutionMode.EXTRAPOLATE, classification.mode().orElseThrow());
    }

    @Test
    @DisplayName("Scenario B arbitrates")
    void testCollisionMode() {
        TriggerClassification classification = classifier.classify(record("Manager", "Sr. Manager"));

        assertEquals(ResolutionMode.ARBITRATE, classification.mode().orElseThrow());
    }

    @Test
    @DisplayName("No trigger carries no mode")
    void testNoTriggerHasNoMode() {
        TriggerClassification classification = classifier.classify(record("Manager", "Manager"));

        assertFalse(classification.requiresResolution());
        assertTrue(classification.mode().isEmpty());
    }

    @Test
    @DisplayName("Mode must match the scenario")
    void testInconsistentClassificationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TriggerClassification(
                TriggerScenario.NO_TRIGGER, Optional.of(ResolutionMode.ARBITRATE)));
    }
}

package com.title.reconciliation.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record engine entries with the system actor")
    void testRecordSystemEntry() {
        AuditEntry entry = auditService.record(AuditAction.ACTION_FLAG_ASSIGNED, "job-1", "p1",
                Map.of("actionFlag", "UpdateTitle"));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals(AuditService.SYSTEM_ACTOR, entry.actorId());
        assertEquals("UpdateTitle", entry.details().get("actionFlag"));
        assertEquals(1, auditService.size());
    }

    @Test
    @DisplayName("Should filter by subject, job and action")
    void testQueries() {
        auditService.record(AuditAction.JOB_STATUS_CHANGED, "job-1", "job-1", Map.of());
        auditService.record(AuditAction.ACTION_FLAG_ASSIGNED, "job-1", "p1", Map.of());
        auditService.record(AuditAction.ACTION_FLAG_ASSIGNED, "job-2", "p1", Map.of());

        assertEquals(2, auditService.getEntriesForSubject("p1").size());
        assertEquals(2, auditService.getEntriesForJob("job-1").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.ACTION_FLAG_ASSIGNED).size());
        assertTrue(auditService.getEntriesByAction(AuditAction.AGGREGATION_CONFLICT).isEmpty());
    }

    @Test
    @DisplayName("Entries are immutable snapshots")
    void testImmutability() {
        Map<String, Object> details = new HashMap<>();
        details.put("k", "v");
        AuditEntry entry = auditService.record(AuditAction.COMPANY_DECISION_MADE, "job-1", "name:acme", details);
        details.put("k", "changed");

        assertEquals("v", entry.details().get("k"));
        List<AuditEntry> all = auditService.getAllEntries();
        assertThrows(UnsupportedOperationException.class, () -> all.add(entry));
    }

    @Test
    @DisplayName("Builder accepts an explicit actor")
    void testExplicitActor() {
        AuditEntry entry = auditService.record(AuditEntry.builder()
                .action(AuditAction.MANUAL_REVIEW_COMPLETED)
                .subjectId("p1")
                .actorId("reviewer-9")
                .build());

        assertEquals("reviewer-9", entry.actorId());
        assertNull(entry.jobId());
    }

    @Test
    @DisplayName("Action is required")
    void testActionRequired() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().subjectId("p1").build());
    }
}

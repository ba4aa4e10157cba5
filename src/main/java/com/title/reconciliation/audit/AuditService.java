package com.title.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only store for audit entries. Safe to call from worker threads.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final List<AuditEntry> entries;

    public AuditService() {
        this.entries = new CopyOnWriteArrayList<>();
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} subjectId={} jobId={} actor={}",
                entry.action(), entry.subjectId(), entry.jobId(), entry.actorId());
        return entry;
    }

    /**
     * Records an entry performed by the engine within a job.
     */
    public AuditEntry record(AuditAction action, String jobId, String subjectId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .jobId(jobId)
                .subjectId(subjectId)
                .details(details)
                .build());
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesForJob(String jobId) {
        return entries.stream()
                .filter(e -> jobId.equals(e.jobId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}

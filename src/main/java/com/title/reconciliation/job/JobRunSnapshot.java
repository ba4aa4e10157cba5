package com.title.reconciliation.job;

import java.time.Instant;

/**
 * Point-in-time copy of a {@link JobRun}, safe to hand to other threads and sinks.
 */
public record JobRunSnapshot(
        String jobId,
        JobStatus status,
        int total,
        int processed,
        int failed,
        int skipped,
        double completionPercentage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        long processingTimeMs,
        String errorMessage,
        boolean cancelRequested
) {
}

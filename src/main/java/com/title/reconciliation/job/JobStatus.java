package com.title.reconciliation.job;

/**
 * Lifecycle of a reconciliation job: {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 * A pending job may also fail directly when setup is rejected.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}

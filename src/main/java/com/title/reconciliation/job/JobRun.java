package com.title.reconciliation.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of one reconciliation job.
 *
 * <p>Workers only touch the counters through the increment methods. {@code processed} never
 * decreases and never exceeds {@code total}. Status changes are compare-and-set, so terminal
 * states are final even under concurrent callers.</p>
 */
public class JobRun {

    private final String jobId;
    private final int total;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.PENDING);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile String errorMessage;

    public JobRun(String jobId, int total) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is required");
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
        this.total = total;
        this.createdAt = Instant.now();
    }

    /**
     * Creates a pending job with a random id.
     */
    public static JobRun create(int total) {
        return new JobRun(UUID.randomUUID().toString(), total);
    }

    public String getJobId() {
        return jobId;
    }

    public int getTotal() {
        return total;
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getSkipped() {
        return skipped.get();
    }

    public JobStatus getStatus() {
        return status.get();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * PENDING to RUNNING.
     *
     * @return false when the job was not pending
     */
    public boolean start() {
        if (status.compareAndSet(JobStatus.PENDING, JobStatus.RUNNING)) {
            startedAt = Instant.now();
            return true;
        }
        return false;
    }

    /**
     * RUNNING to COMPLETED. Only allowed once every record has been processed.
     *
     * @return false when the job was not running
     * @throws IllegalStateException when records are still outstanding
     */
    public boolean complete() {
        if (processed.get() != total) {
            throw new IllegalStateException("Job " + jobId + " processed " + processed.get() + " of " + total);
        }
        if (status.compareAndSet(JobStatus.RUNNING, JobStatus.COMPLETED)) {
            completedAt = Instant.now();
            return true;
        }
        return false;
    }

    /**
     * Moves a non-terminal job to FAILED.
     *
     * @return false when the job had already finished
     */
    public boolean fail(String message) {
        JobStatus current = status.get();
        while (!current.isTerminal()) {
            if (status.compareAndSet(current, JobStatus.FAILED)) {
                errorMessage = message;
                completedAt = Instant.now();
                return true;
            }
            current = status.get();
        }
        return false;
    }

    /**
     * Counts one processed record.
     *
     * @return the new processed count
     * @throws IllegalStateException when every record was already counted
     */
    public int incrementProcessed() {
        while (true) {
            int current = processed.get();
            if (current >= total) {
                throw new IllegalStateException("Job " + jobId + " already processed all " + total + " records");
            }
            if (processed.compareAndSet(current, current + 1)) {
                return current + 1;
            }
        }
    }

    public int incrementFailed() {
        return failed.incrementAndGet();
    }

    public int incrementSkipped() {
        return skipped.incrementAndGet();
    }

    /**
     * Asks the job to stop. Records not yet started are skipped; in-flight records finish.
     * Safe to call from any thread.
     */
    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Processed share of the total in percent, rounded to 2 decimals; 0 for an empty job.
     */
    public double completionPercentage() {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(processed.get() * 10000.0 / total) / 100.0;
    }

    /**
     * Time since the job started, up to completion. Zero before start.
     */
    public Duration processingTime() {
        Instant start = startedAt;
        if (start == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(start, end);
    }

    public JobRunSnapshot snapshot() {
        return new JobRunSnapshot(jobId, status.get(), total, processed.get(), failed.get(), skipped.get(),
                completionPercentage(), createdAt, startedAt, completedAt, processingTime().toMillis(),
                errorMessage, cancelRequested.get());
    }

    @Override
    public String toString() {
        return "JobRun{jobId='" + jobId + '\'' +
                ", status=" + status.get() +
                ", processed=" + processed.get() + "/" + total +
                ", failed=" + failed.get() +
                ", skipped=" + skipped.get() + '}';
    }
}

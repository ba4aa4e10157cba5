package com.title.reconciliation.llm;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff policy for transient provider failures.
 *
 * @param maxAttempts    total provider calls allowed, including the first
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff     cap on any single wait
 * @param multiplier     growth factor between consecutive waits
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff is required");
        Objects.requireNonNull(maxBackoff, "maxBackoff is required");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 3 attempts, waits of 4s then 8s, capped at 10s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(4), Duration.ofSeconds(10), 2.0);
    }

    /**
     * Single attempt, never waits.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Wait after the given failed attempt (1-based) and before the next one.
     */
    public Duration backoffFor(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}

package com.title.reconciliation.llm;

import java.time.Duration;

/**
 * Blocks the calling thread for a backoff period.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };
}

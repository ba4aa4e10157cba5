package com.title.reconciliation.core.model;

import java.util.Objects;

/**
 * Outcome of resolving one person's title through the model.
 * Immutable audit value; consumed once by the action flag assigner.
 *
 * @param resolvedTitle  the clean title, or null when review is required
 * @param confidence     0.0 to 1.0
 * @param reviewRequired true when a human must decide
 * @param rawModelOutput last raw text returned by the provider, may be null
 * @param outcome        how the resolution ended
 * @param attempts       number of provider calls issued (0 for cache hits)
 */
public record ResolutionResult(
        String resolvedTitle,
        double confidence,
        boolean reviewRequired,
        String rawModelOutput,
        ResolutionOutcome outcome,
        int attempts
) {
    public ResolutionResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome == ResolutionOutcome.RESOLVED && (resolvedTitle == null || reviewRequired)) {
            throw new IllegalArgumentException("A resolved result needs a title and no review flag");
        }
    }

    public static ResolutionResult resolved(String title, double confidence, String raw, int attempts) {
        return new ResolutionResult(title, confidence, false, raw, ResolutionOutcome.RESOLVED, attempts);
    }

    public static ResolutionResult reviewManual(double confidence, String raw, int attempts) {
        return new ResolutionResult(null, confidence, true, raw, ResolutionOutcome.REVIEW_MANUAL, attempts);
    }

    public static ResolutionResult parseError(double confidence, String raw, int attempts) {
        return new ResolutionResult(null, confidence, true, raw, ResolutionOutcome.PARSE_ERROR, attempts);
    }

    public static ResolutionResult retriesExhausted(int attempts) {
        return new ResolutionResult(null, 0.0, true, null, ResolutionOutcome.RETRIES_EXHAUSTED, attempts);
    }

    public static ResolutionResult providerError(String raw, int attempts) {
        return new ResolutionResult(null, 0.0, true, raw, ResolutionOutcome.PROVIDER_ERROR, attempts);
    }

    /**
     * True when no usable answer came back from the provider at all.
     */
    public boolean isFailure() {
        return outcome == ResolutionOutcome.RETRIES_EXHAUSTED || outcome == ResolutionOutcome.PROVIDER_ERROR;
    }

    /**
     * Returns the same result marked as served from cache (no new provider calls).
     */
    public ResolutionResult asCached() {
        return new ResolutionResult(resolvedTitle, confidence, reviewRequired, rawModelOutput, outcome, 0);
    }
}

package com.title.reconciliation.core.model;

/**
 * How a title resolution attempt ended.
 */
public enum ResolutionOutcome {
    RESOLVED,
    REVIEW_MANUAL,
    PARSE_ERROR,
    RETRIES_EXHAUSTED,
    PROVIDER_ERROR
}

package com.title.reconciliation.core.model;

/**
 * Why a record was routed to human review.
 */
public enum ReviewReason {
    RESOLVER_REVIEW_MANUAL,
    RESOLVER_PARSE_ERROR,
    RESOLVER_FAILED,
    AUGMENTATION_NOT_MATCHED,
    RECORD_ERROR
}

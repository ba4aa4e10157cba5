package com.title.reconciliation.review;

/**
 * Status of a review item in the manual review queue.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}

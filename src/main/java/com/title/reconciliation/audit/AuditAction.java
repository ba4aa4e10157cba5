package com.title.reconciliation.audit;

/**
 * Types of auditable actions in the reconciliation engine.
 */
public enum AuditAction {
    JOB_STATUS_CHANGED,
    LLM_RESOLUTION_COMPLETED,
    ACTION_FLAG_ASSIGNED,
    COMPANY_DECISION_MADE,
    AGGREGATION_CONFLICT,
    MANUAL_REVIEW_REQUESTED,
    MANUAL_REVIEW_COMPLETED
}

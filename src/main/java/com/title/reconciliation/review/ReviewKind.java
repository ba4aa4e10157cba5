package com.title.reconciliation.review;

/**
 * What a reviewer is asked to decide.
 */
public enum ReviewKind {
    /**
     * A person's title could not be resolved automatically.
     */
    TITLE,

    /**
     * A person's company changed without a matched augmentation.
     */
    COMPANY_CHANGE
}

package com.title.reconciliation.core.model;

/**
 * Person-level outcome handed to downstream consumers.
 * Every record receives exactly one flag.
 */
public enum ActionFlag {
    UPDATE_TITLE("UpdateTitle"),
    REVIEW_TITLE("ReviewTitle"),
    KEEP_ORIGINAL("KeepOriginal");

    private final String label;

    ActionFlag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

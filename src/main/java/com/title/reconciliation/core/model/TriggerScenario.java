package com.title.reconciliation.core.model;

/**
 * Classification of a person record with respect to title resolution.
 */
public enum TriggerScenario {
    /**
     * Internal title is empty and the feed supplies one (scenario A).
     */
    NEW_TITLE_AVAILABLE,

    /**
     * Both titles are present and disagree (scenario B).
     */
    TITLE_COLLISION,

    /**
     * Nothing to resolve; the internal title is kept.
     */
    NO_TRIGGER;

    public boolean requiresResolution() {
        return this != NO_TRIGGER;
    }
}

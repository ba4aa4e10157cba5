package com.title.reconciliation.core.model;

import java.util.Objects;

/**
 * Person-level output row: the original record plus the engine's appended fields.
 *
 * @param person        the input record, unchanged
 * @param scenario      trigger classification
 * @param resolvedTitle title to apply or keep; null when review found no usable title
 * @param actionFlag    terminal action for the record
 * @param reviewReason  why review is needed, null unless the flag is REVIEW_TITLE
 * @param resolution    resolver output, null when no resolution was triggered
 * @param failed        true when the record's resolution failed outright
 */
public record ActionableRecord(
        PersonRecord person,
        TriggerScenario scenario,
        String resolvedTitle,
        ActionFlag actionFlag,
        ReviewReason reviewReason,
        ResolutionResult resolution,
        boolean failed
) {
    public ActionableRecord {
        Objects.requireNonNull(person, "person is required");
        Objects.requireNonNull(scenario, "scenario is required");
        Objects.requireNonNull(actionFlag, "actionFlag is required");
    }

    public String personId() {
        return person.personId();
    }

    public boolean requiresReview() {
        return actionFlag == ActionFlag.REVIEW_TITLE;
    }

    public double confidence() {
        return resolution != null ? resolution.confidence() : 1.0;
    }
}

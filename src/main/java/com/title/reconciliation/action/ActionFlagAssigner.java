package com.title.reconciliation.action;

import com.title.reconciliation.core.model.AugmentationStatus;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionResult;
import com.title.reconciliation.core.model.ReviewReason;
import com.title.reconciliation.trigger.TriggerClassification;

import java.util.Objects;

/**
 * Maps a record's classification and resolver outcome to its terminal {@link FlagAssignment}.
 *
 * <p>An augmentation status of NOT_MATCHED forces review for every record, whatever the
 * resolver said. Otherwise a clean resolution updates the title, any review or failure outcome
 * asks for review, and an untriggered record keeps its original title.</p>
 */
public class ActionFlagAssigner {

    /**
     * @param person         the input record
     * @param classification trigger classification of the record
     * @param resolution     resolver output, null when resolution was not triggered
     */
    public FlagAssignment assign(PersonRecord person, TriggerClassification classification,
                                 ResolutionResult resolution) {
        Objects.requireNonNull(person, "person is required");
        Objects.requireNonNull(classification, "classification is required");

        if (person.augmentationStatus() == AugmentationStatus.NOT_MATCHED) {
            return FlagAssignment.review(ReviewReason.AUGMENTATION_NOT_MATCHED);
        }
        if (!classification.requiresResolution()) {
            return FlagAssignment.keepOriginal();
        }
        if (resolution == null) {
            return FlagAssignment.review(ReviewReason.RECORD_ERROR);
        }
        if (resolution.resolvedTitle() != null && !resolution.reviewRequired()) {
            return FlagAssignment.updateTitle();
        }
        return FlagAssignment.review(reasonFor(resolution));
    }

    private static ReviewReason reasonFor(ResolutionResult resolution) {
        return switch (resolution.outcome()) {
            case PARSE_ERROR -> ReviewReason.RESOLVER_PARSE_ERROR;
            case RETRIES_EXHAUSTED, PROVIDER_ERROR -> ReviewReason.RESOLVER_FAILED;
            case REVIEW_MANUAL, RESOLVED -> ReviewReason.RESOLVER_REVIEW_MANUAL;
        };
    }
}

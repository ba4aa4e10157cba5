package com.title.reconciliation.action;

import com.title.reconciliation.core.model.ActionFlag;
import com.title.reconciliation.core.model.ReviewReason;

import java.util.Objects;

/**
 * Flag chosen for one record, with the review reason when the flag is REVIEW_TITLE.
 */
public record FlagAssignment(ActionFlag actionFlag, ReviewReason reviewReason) {

    public FlagAssignment {
        Objects.requireNonNull(actionFlag, "actionFlag is required");
        if (actionFlag == ActionFlag.REVIEW_TITLE && reviewReason == null) {
            throw new IllegalArgumentException("REVIEW_TITLE needs a review reason");
        }
        if (actionFlag != ActionFlag.REVIEW_TITLE && reviewReason != null) {
            throw new IllegalArgumentException("Only REVIEW_TITLE carries a review reason");
        }
    }

    public static FlagAssignment keepOriginal() {
        return new FlagAssignment(ActionFlag.KEEP_ORIGINAL, null);
    }

    public static FlagAssignment updateTitle() {
        return new FlagAssignment(ActionFlag.UPDATE_TITLE, null);
    }

    public static FlagAssignment review(ReviewReason reason) {
        return new FlagAssignment(ActionFlag.REVIEW_TITLE, reason);
    }
}

package com.title.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One master data decision per company group.
 *
 * @param companyKey         normalized key shared by the group
 * @param decision           job change or data update
 * @param unifiedFields      latest-value-wins merge of firmographics across the group
 * @param sourceRecordCount  group size
 * @param personIds          members, in input order
 * @param jobChangePersonIds members who moved here from a different employer
 * @param reviewPersonIds    members whose company changed without a matched augmentation
 * @param conflict           name disagreement inside the group, or null
 */
public record CompanyMdmDecision(
        NormalizedKey companyKey,
        MdmDecision decision,
        Firmographics unifiedFields,
        int sourceRecordCount,
        List<String> personIds,
        List<String> jobChangePersonIds,
        List<String> reviewPersonIds,
        AggregationConflict conflict
) {
    public CompanyMdmDecision {
        Objects.requireNonNull(companyKey, "companyKey is required");
        Objects.requireNonNull(decision, "decision is required");
        unifiedFields = unifiedFields != null ? unifiedFields : Firmographics.empty();
        personIds = personIds != null ? List.copyOf(personIds) : List.of();
        jobChangePersonIds = jobChangePersonIds != null ? List.copyOf(jobChangePersonIds) : List.of();
        reviewPersonIds = reviewPersonIds != null ? List.copyOf(reviewPersonIds) : List.of();
        if (sourceRecordCount < 1) {
            throw new IllegalArgumentException("sourceRecordCount must be >= 1");
        }
    }

    public boolean reviewRequired() {
        return !reviewPersonIds.isEmpty();
    }

    public boolean hasConflict() {
        return conflict != null;
    }
}

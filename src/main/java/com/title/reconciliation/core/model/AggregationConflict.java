package com.title.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Records inside one company group whose company names normalize to different keys.
 * Resolved by letting the most recent record's name win.
 *
 * @param companyKey  the group key
 * @param nameKeys    distinct normalized names seen in the group
 * @param winningName the name that was kept
 */
public record AggregationConflict(String companyKey, List<String> nameKeys, String winningName) {

    public AggregationConflict {
        Objects.requireNonNull(companyKey, "companyKey is required");
        nameKeys = nameKeys != null ? List.copyOf(nameKeys) : List.of();
    }
}

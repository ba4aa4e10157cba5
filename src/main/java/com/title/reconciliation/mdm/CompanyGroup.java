package com.title.reconciliation.mdm;

import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.NormalizedKey;

import java.util.List;
import java.util.Objects;

/**
 * Records of one job that share a normalized company key, in input order.
 * Lives only while the job's decisions are being built.
 */
public record CompanyGroup(NormalizedKey key, List<ActionableRecord> members) {

    public CompanyGroup {
        Objects.requireNonNull(key, "key is required");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A company group needs at least one member");
        }
    }

    public int size() {
        return members.size();
    }
}

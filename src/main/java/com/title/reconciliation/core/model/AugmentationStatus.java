package com.title.reconciliation.core.model;

import java.util.Locale;

/**
 * Match status reported by the augmentation feed for a person record.
 */
public enum AugmentationStatus {
    MATCHED("Matched"),
    NOT_MATCHED("NotMatched"),
    PENDING("Pending");

    private final String label;

    AugmentationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a status label leniently. Separators and case are ignored, so
     * "NotMatched", "not_matched" and "NOT MATCHED" are all accepted.
     * Blank or unknown values parse to {@link #PENDING}.
     */
    public static AugmentationStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        String compact = value.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
        return switch (compact) {
            case "matched", "match" -> MATCHED;
            case "notmatched", "unmatched", "nomatch" -> NOT_MATCHED;
            default -> PENDING;
        };
    }
}

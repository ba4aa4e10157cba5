package com.title.reconciliation.core.model;

/**
 * Company-level master data decision for a group of person records.
 */
public enum MdmDecision {
    /**
     * At least one person moved to a genuinely different employer.
     */
    TRUE_JOB_CHANGE("TrueJobChange"),

    /**
     * Same employer entity; only firmographic details were refreshed.
     */
    COMPANY_DATA_UPDATE("CompanyDataUpdate");

    private final String label;

    MdmDecision(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

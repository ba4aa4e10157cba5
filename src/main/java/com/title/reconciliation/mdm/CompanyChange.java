package com.title.reconciliation.mdm;

/**
 * How a single record's internal company relates to its effective company.
 */
enum CompanyChange {
    /**
     * Same company, or no internal company to compare against.
     */
    NONE,

    /**
     * Different company confirmed by a matched augmentation.
     */
    CONFIRMED,

    /**
     * Company looks different but the augmentation is not matched, or the two sides
     * share no comparable identifier.
     */
    UNVERIFIED
}

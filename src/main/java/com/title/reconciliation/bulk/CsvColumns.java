package com.title.reconciliation.bulk;

/**
 * Column names shared by the CSV reader and exporter.
 */
final class CsvColumns {
    static final String PERSON_ID = "person_id";
    static final String TITLE_INPUT = "title_input";
    static final String TITLE_NEW = "title_new";
    static final String COMPANY_INPUT = "company_input";
    static final String COMPANY_NEW = "company_new";
    static final String DOMAIN_INPUT = "domain_input";
    static final String DOMAIN_NEW = "domain_new";
    static final String AUGMENTATION_STATUS = "augmentation_status";
    static final String INDUSTRY = "industry";
    static final String EMPLOYEE_COUNT = "employee_count";
    static final String REVENUE_RANGE = "revenue_range";
    static final String HEADQUARTERS_LOCATION = "headquarters_location";
    static final String OBSERVED_AT = "observed_at";

    static final String[] INPUT = {
            PERSON_ID, TITLE_INPUT, TITLE_NEW, COMPANY_INPUT, COMPANY_NEW, DOMAIN_INPUT, DOMAIN_NEW,
            AUGMENTATION_STATUS, INDUSTRY, EMPLOYEE_COUNT, REVENUE_RANGE, HEADQUARTERS_LOCATION, OBSERVED_AT
    };

    static final String[] RECORD_OUTPUT = {
            PERSON_ID, TITLE_INPUT, TITLE_NEW, COMPANY_INPUT, COMPANY_NEW, DOMAIN_INPUT, DOMAIN_NEW,
            AUGMENTATION_STATUS, "scenario", "resolved_title", "action_flag", "review_reason", "confidence"
    };

    static final String[] COMPANY_OUTPUT = {
            "company_key", "decision", "name", "domain", INDUSTRY, EMPLOYEE_COUNT, REVENUE_RANGE,
            HEADQUARTERS_LOCATION, "source_record_count", "review_required"
    };

    private CsvColumns() {
    }
}

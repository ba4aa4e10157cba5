package com.title.reconciliation.bulk;

/**
 * Result of a report export.
 *
 * @param recordRows  person rows written
 * @param companyRows company rows written
 */
public record ExportResult(long recordRows, long companyRows) {

    @Override
    public String toString() {
        return "ExportResult{records=" + recordRows + ", companies=" + companyRows + '}';
    }
}

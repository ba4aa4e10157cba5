package com.title.reconciliation.bulk;

import com.title.reconciliation.core.model.PersonRecord;

import java.util.List;

/**
 * Result of reading a person record file.
 *
 * @param totalRows total number of data rows in the input
 * @param records   rows that became records, in input order
 * @param errors    rows that were rejected
 */
public record ImportResult(long totalRows, List<PersonRecord> records, List<ImportError> errors) {

    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A rejected row.
     *
     * @param recordNumber the 1-based data row number
     * @param personId     the row's person id, when it had one
     * @param message      why the row was rejected
     */
    public record ImportError(long recordNumber, String personId, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRows +
                ", records=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}

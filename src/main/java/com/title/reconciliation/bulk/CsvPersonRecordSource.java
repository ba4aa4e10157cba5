package com.title.reconciliation.bulk;

import com.title.reconciliation.core.model.AugmentationStatus;
import com.title.reconciliation.core.model.Firmographics;
import com.title.reconciliation.core.model.PersonRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.title.reconciliation.bulk.CsvColumns.*;

/**
 * Reads person records from a header-mapped CSV file.
 *
 * <p>Expected columns (any order, header names case-insensitive, all but {@code person_id} optional):</p>
 * <pre>
 * person_id,title_input,title_new,company_input,company_new,domain_input,domain_new,
 * augmentation_status,industry,employee_count,revenue_range,headquarters_location,observed_at
 * </pre>
 *
 * <p>Rows without a person id, rows repeating an earlier row's person id, and rows with an
 * unreadable {@code employee_count} or {@code observed_at} are reported in
 * {@link ImportResult#errors()} and skipped. The first readable row for an id is kept.
 * {@code observed_at} accepts an ISO-8601 instant or a date.</p>
 */
public class CsvPersonRecordSource implements PersonRecordSource {
    private static final Logger log = LoggerFactory.getLogger(CsvPersonRecordSource.class);

    private final Path path;

    public CsvPersonRecordSource(Path path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    @Override
    public List<PersonRecord> read() throws IOException {
        ImportResult result;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            result = parse(reader);
        }
        for (ImportResult.ImportError error : result.errors()) {
            log.warn("csv.row.rejected file={} row={} personId={} error={}",
                    path.getFileName(), error.recordNumber(), error.personId(), error.message());
        }
        return result.records();
    }

    /**
     * Parses CSV content. The reader is consumed but not closed.
     */
    public static ImportResult parse(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();

        List<PersonRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        long totalRows = 0;

        CSVParser parser = format.parse(reader);
        for (CSVRecord row : parser) {
            totalRows++;
            Map<String, String> values = lowerCaseKeys(row.toMap());
            String personId = column(values, PERSON_ID);
            if (personId == null) {
                errors.add(new ImportResult.ImportError(totalRows, null, "missing person_id"));
                continue;
            }
            if (seenIds.contains(personId)) {
                errors.add(new ImportResult.ImportError(totalRows, personId, "duplicate person_id"));
                continue;
            }
            try {
                records.add(toRecord(values, personId, records.size()));
                seenIds.add(personId);
            } catch (IllegalArgumentException e) {
                errors.add(new ImportResult.ImportError(totalRows, personId, e.getMessage()));
            }
        }

        log.info("csv.parsed rows={} records={} errors={}", totalRows, records.size(), errors.size());
        return new ImportResult(totalRows, records, errors);
    }

    private static PersonRecord toRecord(Map<String, String> values, String personId, long sequence) {
        Firmographics firmographics = Firmographics.builder()
                .name(column(values, COMPANY_NEW))
                .domain(column(values, DOMAIN_NEW))
                .industry(column(values, INDUSTRY))
                .employeeCount(parseEmployeeCount(column(values, EMPLOYEE_COUNT)))
                .revenueRange(column(values, REVENUE_RANGE))
                .headquartersLocation(column(values, HEADQUARTERS_LOCATION))
                .build();

        return PersonRecord.builder()
                .personId(personId)
                .sequence(sequence)
                .titleInput(column(values, TITLE_INPUT))
                .titleNew(column(values, TITLE_NEW))
                .companyInput(column(values, COMPANY_INPUT))
                .companyNew(column(values, COMPANY_NEW))
                .domainInput(column(values, DOMAIN_INPUT))
                .domainNew(column(values, DOMAIN_NEW))
                .augmentationStatus(AugmentationStatus.fromLabel(column(values, AUGMENTATION_STATUS)))
                .firmographics(firmographics.isEmpty() ? null : firmographics)
                .observedAt(parseObservedAt(column(values, OBSERVED_AT)))
                .build();
    }

    private static Integer parseEmployeeCount(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.replace(",", "").replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid employee_count: " + value, e);
        }
    }

    private static Instant parseObservedAt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException inner) {
                throw new IllegalArgumentException("invalid observed_at: " + value, inner);
            }
        }
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> raw) {
        Map<String, String> values = new HashMap<>();
        raw.forEach((key, value) -> {
            if (key != null) {
                values.put(key.trim().toLowerCase(Locale.ROOT), value);
            }
        });
        return values;
    }

    private static String column(Map<String, String> values, String name) {
        String value = values.get(name);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

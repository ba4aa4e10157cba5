package com.title.reconciliation.bulk;

import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.Firmographics;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.job.JobReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the two result tables of a job as CSV.
 *
 * <p>Person table:</p>
 * <pre>
 * person_id,title_input,title_new,company_input,company_new,domain_input,domain_new,
 * augmentation_status,scenario,resolved_title,action_flag,review_reason,confidence
 * </pre>
 *
 * <p>Company table:</p>
 * <pre>
 * company_key,decision,name,domain,industry,employee_count,revenue_range,
 * headquarters_location,source_record_count,review_required
 * </pre>
 */
public class CsvReportExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);

    /**
     * Writes {@code <jobId>-records.csv} and {@code <jobId>-companies.csv} into the directory.
     */
    public ExportResult export(JobReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        long recordRows;
        long companyRows;
        try (Writer writer = Files.newBufferedWriter(directory.resolve(report.jobId() + "-records.csv"),
                StandardCharsets.UTF_8)) {
            recordRows = exportRecords(report.records(), writer);
        }
        try (Writer writer = Files.newBufferedWriter(directory.resolve(report.jobId() + "-companies.csv"),
                StandardCharsets.UTF_8)) {
            companyRows = exportCompanies(report.decisions(), writer);
        }
        ExportResult result = new ExportResult(recordRows, companyRows);
        log.info("report.exported jobId={} directory={} {}", report.jobId(), directory, result);
        return result;
    }

    /**
     * Writes the person table. The writer is flushed, not closed.
     *
     * @return rows written, header excluded
     */
    public long exportRecords(List<ActionableRecord> records, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format(CsvColumns.RECORD_OUTPUT));
        for (ActionableRecord record : records) {
            PersonRecord person = record.person();
            printer.printRecord(
                    person.personId(),
                    person.titleInput(),
                    person.titleNew(),
                    person.companyInput(),
                    person.companyNew(),
                    person.domainInput(),
                    person.domainNew(),
                    person.augmentationStatus().getLabel(),
                    record.scenario().name(),
                    record.resolvedTitle(),
                    record.actionFlag().getLabel(),
                    record.reviewReason() != null ? record.reviewReason().name() : null,
                    record.confidence());
        }
        printer.flush();
        return records.size();
    }

    /**
     * Writes the company table. The writer is flushed, not closed.
     *
     * @return rows written, header excluded
     */
    public long exportCompanies(List<CompanyMdmDecision> decisions, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format(CsvColumns.COMPANY_OUTPUT));
        for (CompanyMdmDecision decision : decisions) {
            Firmographics fields = decision.unifiedFields();
            printer.printRecord(
                    decision.companyKey().value(),
                    decision.decision().getLabel(),
                    fields.name(),
                    fields.domain(),
                    fields.industry(),
                    fields.employeeCount(),
                    fields.revenueRange(),
                    fields.headquartersLocation(),
                    decision.sourceRecordCount(),
                    decision.reviewRequired());
        }
        printer.flush();
        return decisions.size();
    }

    private static CSVFormat format(String[] header) {
        return CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setNullString("")
                .build();
    }
}

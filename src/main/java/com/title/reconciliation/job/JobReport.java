package com.title.reconciliation.job;

import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;

import java.util.List;
import java.util.Objects;

/**
 * Output of one job.
 *
 * @param run        final state of the job
 * @param records    person-level results in input order; partial when the job was cancelled
 * @param decisions  company decisions in the order their group was first seen;
 *                   empty unless the job completed
 * @param statistics summary figures
 */
public record JobReport(
        JobRunSnapshot run,
        List<ActionableRecord> records,
        List<CompanyMdmDecision> decisions,
        JobStatistics statistics
) {
    public JobReport {
        Objects.requireNonNull(run, "run is required");
        records = records != null ? List.copyOf(records) : List.of();
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        Objects.requireNonNull(statistics, "statistics is required");
    }

    public String jobId() {
        return run.jobId();
    }

    public JobStatus status() {
        return run.status();
    }

    public boolean isCompleted() {
        return run.status() == JobStatus.COMPLETED;
    }
}

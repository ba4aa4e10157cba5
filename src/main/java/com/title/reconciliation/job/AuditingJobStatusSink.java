package com.title.reconciliation.job;

import com.title.reconciliation.audit.AuditAction;
import com.title.reconciliation.audit.AuditService;
import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.ResolutionResult;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the job's lifecycle, per-record outcomes and company decisions to the audit trail.
 */
public class AuditingJobStatusSink implements JobStatusSink {

    private final AuditService auditService;

    public AuditingJobStatusSink(AuditService auditService) {
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    @Override
    public void onStatusChange(JobRunSnapshot run, JobStatus previous) {
        Map<String, Object> details = new HashMap<>();
        details.put("from", previous.name());
        details.put("to", run.status().name());
        details.put("processed", run.processed());
        details.put("total", run.total());
        if (run.errorMessage() != null) {
            details.put("error", run.errorMessage());
        }
        auditService.record(AuditAction.JOB_STATUS_CHANGED, run.jobId(), run.jobId(), details);
    }

    @Override
    public void onRecordCompleted(String jobId, ActionableRecord record) {
        ResolutionResult resolution = record.resolution();
        if (resolution != null) {
            auditService.record(AuditAction.LLM_RESOLUTION_COMPLETED, jobId, record.personId(), Map.of(
                    "outcome", resolution.outcome().name(),
                    "attempts", resolution.attempts(),
                    "confidence", resolution.confidence(),
                    "resolvedTitle", resolution.resolvedTitle() != null ? resolution.resolvedTitle() : ""
            ));
        }
        Map<String, Object> details = new HashMap<>();
        details.put("scenario", record.scenario().name());
        details.put("actionFlag", record.actionFlag().getLabel());
        if (record.reviewReason() != null) {
            details.put("reviewReason", record.reviewReason().name());
        }
        auditService.record(AuditAction.ACTION_FLAG_ASSIGNED, jobId, record.personId(), details);
    }

    @Override
    public void onJobFinished(JobReport report) {
        for (CompanyMdmDecision decision : report.decisions()) {
            String companyKey = decision.companyKey().toString();
            auditService.record(AuditAction.COMPANY_DECISION_MADE, report.jobId(), companyKey, Map.of(
                    "decision", decision.decision().getLabel(),
                    "sourceRecordCount", decision.sourceRecordCount(),
                    "jobChanges", decision.jobChangePersonIds().size(),
                    "reviewRequired", decision.reviewRequired()
            ));
            if (decision.hasConflict()) {
                auditService.record(AuditAction.AGGREGATION_CONFLICT, report.jobId(), companyKey, Map.of(
                        "nameKeys", String.join("|", decision.conflict().nameKeys()),
                        "winningName", decision.conflict().winningName() != null
                                ? decision.conflict().winningName() : ""
                ));
            }
        }
    }
}

package com.title.reconciliation.review;

import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.job.JobReport;
import com.title.reconciliation.job.JobStatusSink;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Feeds a job's review targets into the review queue: each REVIEW_TITLE record as it completes
 * and each unverified company change once the company decisions exist.
 */
public class ReviewQueueSink implements JobStatusSink {

    private final ReviewService reviewService;

    public ReviewQueueSink(ReviewService reviewService) {
        this.reviewService = Objects.requireNonNull(reviewService, "reviewService is required");
    }

    @Override
    public void onRecordCompleted(String jobId, ActionableRecord record) {
        if (record.requiresReview()) {
            reviewService.submitTitleReview(jobId, record);
        }
    }

    @Override
    public void onJobFinished(JobReport report) {
        if (report.decisions().isEmpty()) {
            return;
        }
        Map<String, PersonRecord> people = new HashMap<>();
        report.records().forEach(record -> people.putIfAbsent(record.personId(), record.person()));
        for (CompanyMdmDecision decision : report.decisions()) {
            if (decision.reviewRequired()) {
                reviewService.submitCompanyReviews(report.jobId(), decision, people);
            }
        }
    }
}

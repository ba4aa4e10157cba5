package com.title.reconciliation.review;

import com.title.reconciliation.audit.AuditAction;
import com.title.reconciliation.audit.AuditEntry;
import com.title.reconciliation.audit.AuditService;
import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.PersonRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Coordinates review queue operations with the audit trail.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final AuditService auditService;

    public ReviewService(ReviewQueue reviewQueue, AuditService auditService) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Queues a record flagged REVIEW_TITLE.
     */
    public ReviewItem submitTitleReview(String jobId, ActionableRecord record) {
        PersonRecord person = record.person();
        ReviewItem item = ReviewItem.builder()
                .kind(ReviewKind.TITLE)
                .jobId(jobId)
                .personId(person.personId())
                .currentValue(person.titleInput())
                .proposedValue(record.resolvedTitle() != null ? record.resolvedTitle() : person.titleNew())
                .reason(record.reviewReason() != null ? record.reviewReason().name() : null)
                .confidence(record.confidence())
                .build();
        return submit(item);
    }

    /**
     * Queues one review per unverified company change in the decision.
     *
     * @param people the job's records by person id
     */
    public List<ReviewItem> submitCompanyReviews(String jobId, CompanyMdmDecision decision,
                                                 Map<String, PersonRecord> people) {
        return decision.reviewPersonIds().stream()
                .map(personId -> {
                    PersonRecord person = people.get(personId);
                    return submit(ReviewItem.builder()
                            .kind(ReviewKind.COMPANY_CHANGE)
                            .jobId(jobId)
                            .personId(personId)
                            .companyKey(decision.companyKey().toString())
                            .currentValue(person != null ? person.companyInput() : null)
                            .proposedValue(decision.unifiedFields().name())
                            .reason("COMPANY_CHANGE_UNVERIFIED")
                            .build());
                })
                .toList();
    }

    /**
     * Submits a review item to the queue and records an audit entry.
     */
    public ReviewItem submit(ReviewItem item) {
        ReviewItem submitted = reviewQueue.submit(item);

        auditService.record(AuditAction.MANUAL_REVIEW_REQUESTED, item.getJobId(), item.getPersonId(),
                Map.of(
                        "reviewItemId", submitted.getId(),
                        "kind", item.getKind().name(),
                        "reason", item.getReason() != null ? item.getReason() : ""
                ));

        log.info("review.submitted reviewItemId={} kind={} personId={} reason={}",
                submitted.getId(), item.getKind(), item.getPersonId(), item.getReason());
        return submitted;
    }

    public void approve(String reviewId, String reviewerId, String notes) {
        complete(reviewId, reviewerId, notes, ReviewStatus.APPROVED);
    }

    public void reject(String reviewId, String reviewerId, String notes) {
        complete(reviewId, reviewerId, notes, ReviewStatus.REJECTED);
    }

    private void complete(String reviewId, String reviewerId, String notes, ReviewStatus outcome) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (outcome == ReviewStatus.APPROVED) {
            reviewQueue.approve(reviewId, reviewerId, notes);
        } else {
            reviewQueue.reject(reviewId, reviewerId, notes);
        }

        auditService.record(AuditEntry.builder()
                .action(AuditAction.MANUAL_REVIEW_COMPLETED)
                .jobId(item.getJobId())
                .subjectId(item.getPersonId())
                .actorId(reviewerId)
                .details(Map.of(
                        "reviewItemId", reviewId,
                        "decision", outcome.name(),
                        "notes", notes != null ? notes : ""
                ))
                .build());

        log.info("review.completed reviewItemId={} decision={} reviewer={}", reviewId, outcome, reviewerId);
    }

    public List<ReviewItem> getPendingReviews() {
        return reviewQueue.getPending();
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }
}

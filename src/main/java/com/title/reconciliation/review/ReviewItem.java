package com.title.reconciliation.review;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An entry in the manual review queue. Created for every record flagged REVIEW_TITLE and
 * for every unverified company change found during consolidation.
 */
public class ReviewItem {

    private final String id;
    private final ReviewKind kind;
    private final String jobId;
    private final String personId;
    private final String companyKey;
    private final String currentValue;
    private final String proposedValue;
    private final String reason;
    private final double confidence;
    private volatile ReviewStatus status;
    private final Instant submittedAt;
    private volatile Instant reviewedAt;
    private volatile String reviewerId;
    private volatile String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.jobId = builder.jobId;
        this.personId = Objects.requireNonNull(builder.personId, "personId is required");
        this.companyKey = builder.companyKey;
        this.currentValue = builder.currentValue;
        this.proposedValue = builder.proposedValue;
        this.reason = builder.reason;
        this.confidence = builder.confidence;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public ReviewKind getKind() {
        return kind;
    }

    public String getJobId() {
        return jobId;
    }

    public String getPersonId() {
        return personId;
    }

    public String getCompanyKey() {
        return companyKey;
    }

    /**
     * The internal value under review: the current title, or the internal company.
     */
    public String getCurrentValue() {
        return currentValue;
    }

    /**
     * The candidate from the augmentation feed or the model.
     */
    public String getProposedValue() {
        return proposedValue;
    }

    public String getReason() {
        return reason;
    }

    public double getConfidence() {
        return confidence;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markReviewed(ReviewStatus outcome, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", personId='" + personId + '\'' +
                ", reason='" + reason + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewKind kind;
        private String jobId;
        private String personId;
        private String companyKey;
        private String currentValue;
        private String proposedValue;
        private String reason;
        private double confidence;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ReviewKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder personId(String personId) {
            this.personId = personId;
            return this;
        }

        public Builder companyKey(String companyKey) {
            this.companyKey = companyKey;
            return this;
        }

        public Builder currentValue(String currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder proposedValue(String proposedValue) {
            this.proposedValue = proposedValue;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}

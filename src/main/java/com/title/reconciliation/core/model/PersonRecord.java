package com.title.reconciliation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One input row: a person's internal title/company alongside the augmentation feed's values.
 * Immutable; the engine never mutates it and reports its outputs on {@link ActionableRecord}.
 *
 * @param personId           identity key, unique within a job
 * @param sequence           position of the row in the input, used as the recency fallback
 * @param titleInput         internal title, may be null or blank
 * @param titleNew           title from the augmentation feed, may be null or blank
 * @param companyInput       internal company name
 * @param companyNew         company name from the augmentation feed
 * @param domainInput        internal company domain
 * @param domainNew          company domain from the augmentation feed
 * @param augmentationStatus match status from the feed, never null
 * @param firmographics      company attributes reported with the row, may be null
 * @param observedAt         when the row was observed, may be null
 */
public record PersonRecord(
        String personId,
        long sequence,
        String titleInput,
        String titleNew,
        String companyInput,
        String companyNew,
        String domainInput,
        String domainNew,
        AugmentationStatus augmentationStatus,
        Firmographics firmographics,
        Instant observedAt
) {
    public PersonRecord {
        Objects.requireNonNull(personId, "personId is required");
        if (personId.isBlank()) {
            throw new IllegalArgumentException("personId must not be blank");
        }
        augmentationStatus = augmentationStatus != null ? augmentationStatus : AugmentationStatus.PENDING;
    }

    public boolean hasTitleInput() {
        return titleInput != null && !titleInput.isBlank();
    }

    public boolean hasTitleNew() {
        return titleNew != null && !titleNew.isBlank();
    }

    /**
     * True when the augmentation side names a company (by name or domain).
     */
    public boolean hasAugmentedCompany() {
        return (companyNew != null && !companyNew.isBlank())
                || (domainNew != null && !domainNew.isBlank());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String personId;
        private long sequence;
        private String titleInput;
        private String titleNew;
        private String companyInput;
        private String companyNew;
        private String domainInput;
        private String domainNew;
        private AugmentationStatus augmentationStatus;
        private Firmographics firmographics;
        private Instant observedAt;

        public Builder personId(String personId) {
            this.personId = personId;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder titleInput(String titleInput) {
            this.titleInput = titleInput;
            return this;
        }

        public Builder titleNew(String titleNew) {
            this.titleNew = titleNew;
            return this;
        }

        public Builder companyInput(String companyInput) {
            this.companyInput = companyInput;
            return this;
        }

        public Builder companyNew(String companyNew) {
            this.companyNew = companyNew;
            return this;
        }

        public Builder domainInput(String domainInput) {
            this.domainInput = domainInput;
            return this;
        }

        public Builder domainNew(String domainNew) {
            this.domainNew = domainNew;
            return this;
        }

        public Builder augmentationStatus(AugmentationStatus augmentationStatus) {
            this.augmentationStatus = augmentationStatus;
            return this;
        }

        public Builder firmographics(Firmographics firmographics) {
            this.firmographics = firmographics;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public PersonRecord build() {
            return new PersonRecord(personId, sequence, titleInput, titleNew, companyInput, companyNew,
                    domainInput, domainNew, augmentationStatus, firmographics, observedAt);
        }
    }
}

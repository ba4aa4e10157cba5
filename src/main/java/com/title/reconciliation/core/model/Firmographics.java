package com.title.reconciliation.core.model;

/**
 * Company attributes carried alongside a person record and merged per company group.
 * All fields are nullable; a null field means "unknown", never "cleared".
 */
public record Firmographics(
        String name,
        String domain,
        String industry,
        Integer employeeCount,
        String revenueRange,
        String headquartersLocation
) {
    private static final Firmographics EMPTY = new Firmographics(null, null, null, null, null, null);

    public static Firmographics empty() {
        return EMPTY;
    }

    /**
     * Returns a copy in which every non-null field of {@code newer} replaces this one's.
     */
    public Firmographics overlay(Firmographics newer) {
        if (newer == null) {
            return this;
        }
        return new Firmographics(
                pick(newer.name, name),
                pick(newer.domain, domain),
                pick(newer.industry, industry),
                newer.employeeCount != null ? newer.employeeCount : employeeCount,
                pick(newer.revenueRange, revenueRange),
                pick(newer.headquartersLocation, headquartersLocation)
        );
    }

    public Firmographics withNameAndDomain(String name, String domain) {
        return new Firmographics(name, domain, industry, employeeCount, revenueRange, headquartersLocation);
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    private static String pick(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String domain;
        private String industry;
        private Integer employeeCount;
        private String revenueRange;
        private String headquartersLocation;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder employeeCount(Integer employeeCount) {
            this.employeeCount = employeeCount;
            return this;
        }

        public Builder revenueRange(String revenueRange) {
            this.revenueRange = revenueRange;
            return this;
        }

        public Builder headquartersLocation(String headquartersLocation) {
            this.headquartersLocation = headquartersLocation;
            return this;
        }

        public Firmographics build() {
            return new Firmographics(name, domain, industry, employeeCount, revenueRange, headquartersLocation);
        }
    }
}

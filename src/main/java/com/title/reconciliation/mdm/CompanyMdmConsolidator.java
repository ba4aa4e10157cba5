package com.title.reconciliation.mdm;

import com.title.reconciliation.core.model.ActionableRecord;
import com.title.reconciliation.core.model.AggregationConflict;
import com.title.reconciliation.core.model.AugmentationStatus;
import com.title.reconciliation.core.model.CompanyMdmDecision;
import com.title.reconciliation.core.model.Firmographics;
import com.title.reconciliation.core.model.MdmDecision;
import com.title.reconciliation.core.model.NormalizedKey;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.metrics.MetricsService;
import com.title.reconciliation.metrics.NoOpMetricsService;
import com.title.reconciliation.rules.CompanyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rolls per-person results up into one master data decision per company.
 *
 * <p>Records are grouped by the normalized key of their effective company: the augmentation
 * side when the feed supplied a company or domain, otherwise the internal side. A group is a
 * {@link MdmDecision#TRUE_JOB_CHANGE} when at least one member moved there from a different
 * internal company under a matched augmentation; otherwise it is a
 * {@link MdmDecision#COMPANY_DATA_UPDATE}. Firmographics are merged so that the most recent
 * non-null value of each attribute wins.</p>
 */
public class CompanyMdmConsolidator {
    private static final Logger log = LoggerFactory.getLogger(CompanyMdmConsolidator.class);

    /**
     * Oldest first: missing timestamps are oldest, ties prefer MATCHED as newer, then input order.
     */
    static final Comparator<PersonRecord> RECENCY = Comparator
            .comparing(PersonRecord::observedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(p -> p.augmentationStatus() == AugmentationStatus.MATCHED)
            .thenComparingLong(PersonRecord::sequence);

    private final CompanyNormalizer normalizer;
    private final MetricsService metrics;

    public CompanyMdmConsolidator() {
        this(new CompanyNormalizer(), new NoOpMetricsService());
    }

    public CompanyMdmConsolidator(CompanyNormalizer normalizer, MetricsService metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Builds one decision per company group.
     *
     * @param records actionable records of one job, in input order
     * @return decisions in the order each group was first seen
     */
    public List<CompanyMdmDecision> consolidate(List<ActionableRecord> records) {
        List<CompanyMdmDecision> decisions = new ArrayList<>();
        for (CompanyGroup group : group(records)) {
            CompanyMdmDecision decision = decide(group);
            metrics.incrementCompanyDecision(decision.decision());
            log.debug("mdm.decision companyKey={} decision={} records={} review={}",
                    decision.companyKey(), decision.decision(), decision.sourceRecordCount(),
                    decision.reviewRequired());
            decisions.add(decision);
        }
        log.info("mdm.consolidated records={} groups={}", records.size(), decisions.size());
        return decisions;
    }

    /**
     * Groups records by the normalized key of their effective company.
     * Records with no usable company identity share the empty-key group.
     */
    public List<CompanyGroup> group(List<ActionableRecord> records) {
        Map<NormalizedKey, List<ActionableRecord>> byKey = new LinkedHashMap<>();
        for (ActionableRecord record : records) {
            byKey.computeIfAbsent(effectiveKey(record.person()), k -> new ArrayList<>()).add(record);
        }
        List<CompanyGroup> groups = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> groups.add(new CompanyGroup(key, members)));
        return groups;
    }

    /**
     * Key of the company the record should be attributed to.
     */
    public NormalizedKey effectiveKey(PersonRecord person) {
        return normalizer.normalize(effectiveName(person), effectiveDomain(person));
    }

    CompanyMdmDecision decide(CompanyGroup group) {
        List<PersonRecord> byRecency = group.members().stream()
                .map(ActionableRecord::person)
                .sorted(RECENCY)
                .toList();

        List<String> personIds = new ArrayList<>();
        List<String> jobChanges = new ArrayList<>();
        List<String> reviews = new ArrayList<>();
        for (ActionableRecord member : group.members()) {
            PersonRecord person = member.person();
            personIds.add(person.personId());
            switch (companyChange(person)) {
                case CONFIRMED -> jobChanges.add(person.personId());
                case UNVERIFIED -> reviews.add(person.personId());
                case NONE -> {
                }
            }
        }

        String winningName = newestNonBlank(byRecency, true);
        AggregationConflict conflict = detectConflict(group.key(), byRecency, winningName);

        Firmographics unified = Firmographics.empty();
        for (PersonRecord person : byRecency) {
            unified = unified.overlay(person.firmographics());
        }
        String name = unified.name() != null ? unified.name() : winningName;
        String domain = unified.domain() != null ? unified.domain() : newestNonBlank(byRecency, false);
        unified = unified.withNameAndDomain(name, domain);

        MdmDecision decision = jobChanges.isEmpty() ? MdmDecision.COMPANY_DATA_UPDATE : MdmDecision.TRUE_JOB_CHANGE;
        return new CompanyMdmDecision(group.key(), decision, unified, group.size(),
                personIds, jobChanges, reviews, conflict);
    }

    /**
     * Compares the record's internal company with its effective company. Domains are compared when
     * both sides have a well-formed one, names otherwise.
     */
    CompanyChange companyChange(PersonRecord person) {
        if (!person.hasAugmentedCompany()) {
            return CompanyChange.NONE;
        }
        Optional<String> internalDomain = normalizer.normalizeDomain(person.domainInput());
        Optional<String> effectiveDomain = normalizer.normalizeDomain(effectiveDomain(person));
        String internalName = normalizer.normalizeName(person.companyInput());
        String effectiveName = normalizer.normalizeName(effectiveName(person));

        if (internalDomain.isEmpty() && internalName.isEmpty()) {
            return CompanyChange.NONE;
        }

        boolean differs;
        if (internalDomain.isPresent() && effectiveDomain.isPresent()) {
            differs = !internalDomain.get().equals(effectiveDomain.get());
        } else if (!internalName.isEmpty() && !effectiveName.isEmpty()) {
            differs = !internalName.equals(effectiveName);
        } else {
            return CompanyChange.UNVERIFIED;
        }

        if (!differs) {
            return CompanyChange.NONE;
        }
        return person.augmentationStatus() == AugmentationStatus.MATCHED
                ? CompanyChange.CONFIRMED
                : CompanyChange.UNVERIFIED;
    }

    private AggregationConflict detectConflict(NormalizedKey key, List<PersonRecord> byRecency, String winningName) {
        Set<String> nameKeys = new LinkedHashSet<>();
        for (PersonRecord person : byRecency) {
            String nameKey = normalizer.normalizeName(effectiveName(person));
            if (!nameKey.isEmpty()) {
                nameKeys.add(nameKey);
            }
        }
        if (nameKeys.size() <= 1) {
            return null;
        }
        AggregationConflict conflict = new AggregationConflict(key.toString(), List.copyOf(nameKeys), winningName);
        log.warn("mdm.aggregation.conflict companyKey={} nameKeys={} winner={}", key, nameKeys, winningName);
        return conflict;
    }

    private String newestNonBlank(List<PersonRecord> byRecency, boolean name) {
        for (int i = byRecency.size() - 1; i >= 0; i--) {
            PersonRecord person = byRecency.get(i);
            String value = name ? effectiveName(person) : effectiveDomain(person);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String effectiveName(PersonRecord person) {
        return person.hasAugmentedCompany() ? person.companyNew() : person.companyInput();
    }

    /**
     * The augmentation's domain, or the internal one when the feed named the same company
     * without a domain.
     */
    private String effectiveDomain(PersonRecord person) {
        if (!person.hasAugmentedCompany()) {
            return person.domainInput();
        }
        if (person.domainNew() != null && !person.domainNew().isBlank()) {
            return person.domainNew();
        }
        String internalName = normalizer.normalizeName(person.companyInput());
        if (!internalName.isEmpty() && internalName.equals(normalizer.normalizeName(person.companyNew()))) {
            return person.domainInput();
        }
        return null;
    }
}

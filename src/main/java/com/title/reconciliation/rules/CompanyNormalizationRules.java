package com.title.reconciliation.rules;

import java.util.List;

/**
 * Built-in rules for company names: legal suffixes, the leading article,
 * conjunctions and punctuation.
 */
public final class CompanyNormalizationRules {

    /**
     * Legal entity suffixes stripped from the end of a company name.
     */
    static final String LEGAL_SUFFIXES =
            "inc|incorporated|llc|l\\.l\\.c|llp|l\\.l\\.p|lp|l\\.p|corp|corporation|co|company"
                    + "|ltd|limited|plc|p\\.l\\.c|gmbh|ag|s\\.?a|n\\.?v|b\\.?v|pty|s\\.?r\\.?l";

    private CompanyNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all company rules.
     */
    public static NormalizationEngine createEngine() {
        return new NormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("company-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("company-and")
                        .pattern("\\s+and\\s+")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // Keep dots and commas for now, suffixes like "L.L.C." depend on them
                NormalizationRule.builder()
                        .name("company-symbols")
                        .pattern("[^a-zA-Z0-9\\s.,]")
                        .replacement(" ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("company-the")
                        .pattern("^\\s*The\\s+")
                        .replacement("")
                        .priority(30)
                        .build(),

                // "Acme Holdings Co., Ltd." loses both suffixes
                NormalizationRule.builder()
                        .name("company-legal-suffix")
                        .pattern("[\\s.,]+(?:" + LEGAL_SUFFIXES + ")\\.?[\\s.,]*$")
                        .replacement("")
                        .priority(40)
                        .repeatable(true)
                        .build(),

                NormalizationRule.builder()
                        .name("company-punctuation")
                        .pattern("[^a-zA-Z0-9\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("company-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}

package com.title.reconciliation.llm;

import com.title.reconciliation.core.model.AugmentationStatus;
import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TitlePromptBuilderTest {

    private final TitlePromptBuilder builder = new TitlePromptBuilder();

    @Test
    @DisplayName("Extrapolate prompt carries the provider title only")
    void testExtrapolatePrompt() {
        PersonRecord person = PersonRecord.builder()
                .personId("p1")
                .titleNew("VP of Sales")
                .companyNew("Acme Inc.")
                .augmentationStatus(AugmentationStatus.MATCHED)
                .build();

        String prompt = builder.build(person, ResolutionMode.EXTRAPOLATE);

        assertTrue(prompt.contains("Mode: extrapolate"));
        assertTrue(prompt.contains("Provider title: \"VP of Sales\""));
        assertFalse(prompt.contains("Internal title"));
        assertTrue(prompt.contains("Provider company: \"Acme Inc.\""));
        assertTrue(prompt.contains("Provider match status: Matched"));
        assertTrue(prompt.contains(ModelResponseParser.REVIEW_MANUAL));
    }

    @Test
    @DisplayName("Arbitrate prompt carries both titles")
    void testArbitratePrompt() {
        PersonRecord person = PersonRecord.builder()
                .personId("p1")
                .titleInput("Manager")
                .titleNew("Sr. Manager")
                .build();

        String prompt = builder.build(person, ResolutionMode.ARBITRATE);

        assertTrue(prompt.contains("Mode: arbitrate"));
        assertTrue(prompt.contains("Internal title: \"Manager\""));
        assertTrue(prompt.contains("Provider title: \"Sr. Manager\""));
        assertFalse(prompt.contains("Provider company:"));
        assertTrue(prompt.contains("Provider match status: Pending"));
    }
}

package com.title.reconciliation.llm;

import com.title.reconciliation.core.model.PersonRecord;
import com.title.reconciliation.core.model.ResolutionMode;

/**
 * Builds the scenario-specific prompt for a title resolution request.
 */
public class TitlePromptBuilder {

    public String build(PersonRecord person, ResolutionMode mode) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("You are a B2B contact data steward. Your task is to determine the most accurate ");
        prompt.append("current job title for one person.\n");
        prompt.append("Mode: ").append(mode.getValue()).append("\n\n");

        switch (mode) {
            case EXTRAPOLATE -> {
                prompt.append("Our internal record has no job title for this person. ");
                prompt.append("A third-party data provider reports the title below.\n\n");
                prompt.append("Provider title: \"").append(nullToEmpty(person.titleNew())).append("\"\n");
            }
            case ARBITRATE -> {
                prompt.append("Our internal record and a third-party data provider disagree on this person's title.\n\n");
                prompt.append("Internal title: \"").append(nullToEmpty(person.titleInput())).append("\"\n");
                prompt.append("Provider title: \"").append(nullToEmpty(person.titleNew())).append("\"\n");
            }
        }

        appendIfPresent(prompt, "Internal company", person.companyInput());
        appendIfPresent(prompt, "Provider company", person.companyNew());
        appendIfPresent(prompt, "Provider company domain", person.domainNew());
        prompt.append("Provider match status: ").append(person.augmentationStatus().getLabel()).append("\n\n");

        prompt.append("Instructions:\n");
        if (mode == ResolutionMode.EXTRAPOLATE) {
            prompt.append("1. Standardize the provider title into a clean, conventional job title.\n");
            prompt.append("2. Expand obvious abbreviations only when unambiguous (e.g. \"VP\" stays acceptable).\n");
        } else {
            prompt.append("1. Decide which title is the person's current one, or merge them if one refines the other.\n");
            prompt.append("2. Prefer the more specific title when both describe the same role.\n");
        }
        prompt.append("3. If the information is contradictory or insufficient, answer exactly ")
                .append(ModelResponseParser.REVIEW_MANUAL).append(".\n\n");

        prompt.append("Respond with ONLY the job title on a single line, or ")
                .append(ModelResponseParser.REVIEW_MANUAL).append(". ");
        prompt.append("Optionally respond as JSON: {\"title\": \"...\", \"confidence\": 0.0-1.0}\n");

        return prompt.toString();
    }

    private static void appendIfPresent(StringBuilder prompt, String label, String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": \"").append(value.trim()).append("\"\n");
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value.trim() : "";
    }
}

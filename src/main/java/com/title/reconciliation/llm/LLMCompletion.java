package com.title.reconciliation.llm;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Raw answer from a model provider.
 *
 * @param text     the generated text, never null
 * @param metadata provider-specific metadata such as {@code confidence} or token counts
 */
public record LLMCompletion(String text, Map<String, Object> metadata) {

    public static final String CONFIDENCE_KEY = "confidence";

    public LLMCompletion {
        Objects.requireNonNull(text, "text is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static LLMCompletion of(String text) {
        return new LLMCompletion(text, Map.of());
    }

    public static LLMCompletion of(String text, double confidence) {
        return new LLMCompletion(text, Map.of(CONFIDENCE_KEY, confidence));
    }

    /**
     * Confidence reported by the provider, when it exposes one as a number or numeric string.
     */
    public OptionalDouble confidence() {
        Object value = metadata.get(CONFIDENCE_KEY);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}

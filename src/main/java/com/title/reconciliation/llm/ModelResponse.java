package com.title.reconciliation.llm;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Decoded model answer. Exactly one of three shapes:
 * a clean title, an explicit request for manual review, or an unparseable answer.
 * Downstream code switches on {@link #kind()} and never looks at raw text.
 */
public final class ModelResponse {

    public enum Kind {
        CLEAN_TITLE,
        REVIEW_REQUIRED,
        PARSE_ERROR
    }

    private static final ModelResponse REVIEW = new ModelResponse(Kind.REVIEW_REQUIRED, null, null, null);

    private final Kind kind;
    private final String title;
    private final Double confidence;
    private final String error;

    private ModelResponse(Kind kind, String title, Double confidence, String error) {
        this.kind = kind;
        this.title = title;
        this.confidence = confidence;
        this.error = error;
    }

    public static ModelResponse cleanTitle(String title) {
        return cleanTitle(title, null);
    }

    public static ModelResponse cleanTitle(String title, Double confidence) {
        Objects.requireNonNull(title, "title is required");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        return new ModelResponse(Kind.CLEAN_TITLE, title, confidence, null);
    }

    public static ModelResponse reviewRequired() {
        return REVIEW;
    }

    public static ModelResponse parseError(String error) {
        return new ModelResponse(Kind.PARSE_ERROR, null, null, error);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The title; only meaningful for {@link Kind#CLEAN_TITLE}.
     */
    public String title() {
        if (kind != Kind.CLEAN_TITLE) {
            throw new IllegalStateException("No title on a " + kind + " response");
        }
        return title;
    }

    /**
     * Confidence stated inside the answer body, if any.
     */
    public OptionalDouble statedConfidence() {
        return confidence != null ? OptionalDouble.of(confidence) : OptionalDouble.empty();
    }

    public String error() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelResponse that = (ModelResponse) o;
        return kind == that.kind
                && Objects.equals(title, that.title)
                && Objects.equals(confidence, that.confidence)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, title, confidence, error);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CLEAN_TITLE -> "CleanTitle{" + title + (confidence != null ? ", confidence=" + confidence : "") + "}";
            case REVIEW_REQUIRED -> "ReviewRequired";
            case PARSE_ERROR -> "ParseError{" + error + "}";
        };
    }
}

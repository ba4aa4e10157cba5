package com.title.reconciliation.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes raw model text into a {@link ModelResponse}.
 *
 * <p>Accepted shapes:</p>
 * <pre>
 * Senior Account Executive
 * Title: Senior Account Executive
 * Confidence: 0.9
 * {"title": "Senior Account Executive", "confidence": 0.9}
 * REVIEW_MANUAL
 * </pre>
 *
 * <p>The sentinel anywhere in the answer means manual review. Anything else that does not
 * reduce to one short line is a parse error.</p>
 */
public class ModelResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ModelResponseParser.class);

    public static final String REVIEW_MANUAL = "REVIEW_MANUAL";
    public static final int DEFAULT_MAX_TITLE_LENGTH = 120;

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);
    private static final Pattern TITLE_LABEL = Pattern.compile("(?i)^(?:resolved[\\s_]+)?title\\s*:\\s*");
    private static final Pattern CONFIDENCE_LINE = Pattern.compile("(?i)^confidence\\s*:\\s*([0-9]*\\.?[0-9]+)\\s*(%?)\\s*$");
    private static final String[] TITLE_FIELDS = {"title", "resolved_title", "resolvedTitle"};

    private final ObjectMapper objectMapper;
    private final int maxTitleLength;

    public ModelResponseParser() {
        this(DEFAULT_MAX_TITLE_LENGTH);
    }

    public ModelResponseParser(int maxTitleLength) {
        if (maxTitleLength <= 0) {
            throw new IllegalArgumentException("maxTitleLength must be > 0");
        }
        this.maxTitleLength = maxTitleLength;
        this.objectMapper = new ObjectMapper();
    }

    public ModelResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ModelResponse.parseError("empty response");
        }

        String text = stripCodeFence(raw.trim());

        if (text.toUpperCase(Locale.ROOT).contains(REVIEW_MANUAL)) {
            return ModelResponse.reviewRequired();
        }

        if (text.startsWith("{")) {
            return parseJson(text);
        }
        return parsePlain(text);
    }

    private ModelResponse parseJson(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Model answer looked like JSON but did not parse: {}", e.getOriginalMessage());
            return ModelResponse.parseError("invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ModelResponse.parseError("JSON answer is not an object");
        }

        String title = null;
        for (String field : TITLE_FIELDS) {
            JsonNode node = root.get(field);
            if (node != null && node.isTextual()) {
                title = node.asText();
                break;
            }
        }

        Double confidence = null;
        JsonNode confidenceNode = root.get("confidence");
        if (confidenceNode != null && confidenceNode.isNumber()) {
            confidence = normalizeConfidence(confidenceNode.asDouble(), false);
        }
        return cleanTitle(title, confidence);
    }

    private ModelResponse parsePlain(String text) {
        List<String> lines = new ArrayList<>();
        Double confidence = null;
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher matcher = CONFIDENCE_LINE.matcher(trimmed);
            if (matcher.matches()) {
                confidence = normalizeConfidence(Double.parseDouble(matcher.group(1)), !matcher.group(2).isEmpty());
                continue;
            }
            lines.add(trimmed);
        }

        if (lines.size() != 1) {
            return ModelResponse.parseError("expected a single title line, got " + lines.size());
        }
        String title = TITLE_LABEL.matcher(lines.get(0)).replaceFirst("");
        return cleanTitle(title, confidence);
    }

    private ModelResponse cleanTitle(String candidate, Double confidence) {
        if (candidate == null) {
            return ModelResponse.parseError("no title in answer");
        }
        String title = stripQuotes(candidate.trim()).replaceAll("\\s+", " ");
        if (title.isEmpty()) {
            return ModelResponse.parseError("blank title");
        }
        if (title.length() > maxTitleLength) {
            return ModelResponse.parseError("title longer than " + maxTitleLength + " characters");
        }
        return ModelResponse.cleanTitle(title, confidence);
    }

    private static String stripCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        return matcher.matches() ? matcher.group(1).trim() : text;
    }

    private static String stripQuotes(String value) {
        String result = value;
        while (result.length() >= 2 && isQuote(result.charAt(0)) && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    /**
     * Accepts 0..1 and percentages; anything else is discarded.
     */
    private static Double normalizeConfidence(double value, boolean percent) {
        double result = value;
        if (percent || (result > 1.0 && result <= 100.0)) {
            result = result / 100.0;
        }
        return result >= 0.0 && result <= 1.0 ? result : null;
    }
}

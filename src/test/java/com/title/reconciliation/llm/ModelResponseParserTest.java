package com.title.reconciliation.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ModelResponseParserTest {

    private final ModelResponseParser parser = new ModelResponseParser();

    @Nested
    @DisplayName("Plain text answers")
    class PlainText {

        @Test
        @DisplayName("Single line is a clean title")
        void testSingleLine() {
            ModelResponse response = parser.parse("Vice President of Sales");

            assertEquals(ModelResponse.Kind.CLEAN_TITLE, response.kind());
            assertEquals("Vice President of Sales", response.title());
            assertTrue(response.statedConfidence().isEmpty());
        }

        @Test
        @DisplayName("Quotes, label and extra spaces are removed")
        void testCleanup() {
            assertEquals("VP of Sales", parser.parse("  \"VP of Sales\"  ").title());
            assertEquals("Senior Manager", parser.parse("Title: Senior   Manager").title());
        }

        @Test
        @DisplayName("Confidence line is read")
        void testConfidenceLine() {
            ModelResponse response = parser.parse("Title: Senior Manager\nConfidence: 0.8");

            assertEquals("Senior Manager", response.title());
            assertEquals(0.8, response.statedConfidence().getAsDouble(), 0.0001);
        }

        @Test
        @DisplayName("Percent confidence is scaled")
        void testPercentConfidence() {
            ModelResponse response = parser.parse("Director of Marketing\nConfidence: 85%");

            assertEquals(0.85, response.statedConfidence().getAsDouble(), 0.0001);
        }

        @Test
        @DisplayName("Multiple title lines are a parse error")
        void testMultipleLines() {
            ModelResponse response = parser.parse("The best title is\nSenior Manager");

            assertEquals(ModelResponse.Kind.PARSE_ERROR, response.kind());
            assertNotNull(response.error());
        }
    }

    @Nested
    @DisplayName("Review sentinel")
    class ReviewSentinel {

        @ParameterizedTest
        @DisplayName("Sentinel anywhere in the answer requests review")
        @ValueSource(strings = {"REVIEW_MANUAL", "review_manual.", "Answer: REVIEW_MANUAL", "{\"title\": \"REVIEW_MANUAL\"}"})
        void testSentinel(String raw) {
            assertEquals(ModelResponse.Kind.REVIEW_REQUIRED, parser.parse(raw).kind());
        }

        @Test
        @DisplayName("Review response has no title")
        void testReviewHasNoTitle() {
            ModelResponse response = parser.parse("REVIEW_MANUAL");

            assertThrows(IllegalStateException.class, response::title);
        }
    }

    @Nested
    @DisplayName("JSON answers")
    class Json {

        @Test
        @DisplayName("Title and confidence fields are read")
        void testJsonFields() {
            ModelResponse response = parser.parse("{\"title\": \"Sr. Manager\", \"confidence\": 0.9}");

            assertEquals("Sr. Manager", response.title());
            assertEquals(0.9, response.statedConfidence().getAsDouble(), 0.0001);
        }

        @Test
        @DisplayName("Code fences are stripped")
        void testCodeFence() {
            ModelResponse response = parser.parse("```json\n{\"resolved_title\": \"CTO\"}\n```");

            assertEquals(ModelResponse.Kind.CLEAN_TITLE, response.kind());
            assertEquals("CTO", response.title());
        }

        @Test
        @DisplayName("Invalid JSON is a parse error")
        void testInvalidJson() {
            assertEquals(ModelResponse.Kind.PARSE_ERROR, parser.parse("{title").kind());
        }

        @Test
        @DisplayName("JSON without a title is a parse error")
        void testMissingTitle() {
            assertEquals(ModelResponse.Kind.PARSE_ERROR, parser.parse("{\"confidence\": 0.5}").kind());
        }
    }

    @ParameterizedTest
    @DisplayName("Empty answers are parse errors")
    @ValueSource(strings = {"", "   ", "\"\""})
    void testEmptyAnswers(String raw) {
        assertEquals(ModelResponse.Kind.PARSE_ERROR, parser.parse(raw).kind());
    }

    @Test
    @DisplayName("Null answer is a parse error")
    void testNullAnswer() {
        assertEquals(ModelResponse.Kind.PARSE_ERROR, parser.parse(null).kind());
    }

    @Test
    @DisplayName("Overlong title is a parse error")
    void testOverlongTitle() {
        ModelResponseParser strict = new ModelResponseParser(10);

        assertEquals(ModelResponse.Kind.PARSE_ERROR, strict.parse("Chief Executive Officer").kind());
        assertEquals(ModelResponse.Kind.CLEAN_TITLE, strict.parse("CEO").kind());
    }
}

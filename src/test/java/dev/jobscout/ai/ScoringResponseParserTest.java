package dev.jobscout.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringResponseParserTest {

    private ScoringResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new ScoringResponseParser(new ObjectMapper());
    }

    @Test
    @DisplayName("Should parse a bare JSON array")
    void shouldParseBareArray() {
        BatchScoringResult result = parser.parse("""
                [
                  {"index": 1, "fit_score": 8, "b2c_validated": true, "reasoning": "Consumer fintech, right level"},
                  {"index": 2, "fit_score": 4.5, "b2c_validated": false, "reasoning": "B2B SaaS"}
                ]
                """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scores()).containsExactly(
                new ItemScore(1, 8.0, true, "Consumer fintech, right level"),
                new ItemScore(2, 4.5, false, "B2B SaaS"));
    }

    @Test
    @DisplayName("Should parse an array inside a markdown code fence")
    void shouldParseCodeFence() {
        BatchScoringResult result = parser.parse("""
                Here are the scores:
                ```json
                [{"index": 1, "fit_score": 7, "b2c_validated": true, "reasoning": "ok"}]
                ```
                """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scores()).hasSize(1);
    }

    @Test
    @DisplayName("Should extract an array surrounded by prose")
    void shouldParseArrayInProse() {
        BatchScoringResult result = parser.parse(
                "Sure! [{\"index\": 1, \"fit_score\": 6, \"reasoning\": \"maybe\"}] Hope this helps.");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scores().get(0).fitScore()).isEqualTo(6.0);
        assertThat(result.scores().get(0).b2cValidated()).isFalse();
    }

    @Test
    @DisplayName("Should clamp scores into 0-10")
    void shouldClampScores() {
        BatchScoringResult result = parser.parse("""
                [{"index": 1, "fit_score": 15}, {"index": 2, "fit_score": -3}]
                """);

        assertThat(result.scores()).extracting(ItemScore::fitScore).containsExactly(10.0, 0.0);
    }

    @Test
    @DisplayName("Should skip array elements that are not objects")
    void shouldSkipNonObjects() {
        BatchScoringResult result = parser.parse("[1, \"two\", {\"index\": 3, \"fit_score\": 5}]");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scores()).extracting(ItemScore::index).containsExactly(3);
    }

    @Test
    @DisplayName("Should fail on unreadable or wrongly shaped responses")
    void shouldFailOnInvalidResponses() {
        assertThat(parser.parse("I cannot score these jobs.").isSuccess()).isFalse();
        assertThat(parser.parse("{\"index\": 1, \"fit_score\": 5}").isSuccess()).isFalse();
        assertThat(parser.parse("[]").isSuccess()).isFalse();
        assertThat(parser.parse("   ").isSuccess()).isFalse();
        assertThat(parser.parse(null).failureReason()).isEqualTo("Empty response");
    }
}

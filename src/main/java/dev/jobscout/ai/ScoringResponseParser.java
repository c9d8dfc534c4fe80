package dev.jobscout.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the JSON score array out of a model completion. Accepts a bare array, an array
 * inside a markdown code fence, or an array surrounded by prose.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoringResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public BatchScoringResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BatchScoringResult.failed("Empty response");
        }

        JsonNode root = readTree(raw.trim());
        if (root == null) {
            Matcher fence = CODE_FENCE.matcher(raw);
            if (fence.find()) {
                root = readTree(fence.group(1).trim());
            }
        }
        if (root == null) {
            int start = raw.indexOf('[');
            int end = raw.lastIndexOf(']');
            if (start >= 0 && end > start) {
                root = readTree(raw.substring(start, end + 1));
            }
        }

        if (root == null) {
            return BatchScoringResult.failed("Response is not valid JSON");
        }
        if (!root.isArray() || root.isEmpty()) {
            return BatchScoringResult.failed("Response is not a non-empty JSON array");
        }

        List<ItemScore> scores = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                continue;
            }
            scores.add(new ItemScore(
                    node.path("index").asInt(0),
                    clamp(node.path("fit_score").asDouble(0)),
                    node.path("b2c_validated").asBoolean(false),
                    node.path("reasoning").asText("")));
        }
        return BatchScoringResult.success(scores);
    }

    private JsonNode readTree(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Not parseable as JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(10, score));
    }
}

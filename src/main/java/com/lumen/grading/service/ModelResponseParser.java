package com.lumen.grading.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.FeedbackItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses raw model output into a {@link ParsedEvaluation}.
 *
 * Accepts the current shape {"score", "feedback": [{"category", "comment"}]}
 * and the older flat shape with "grammar_errors", "vocabulary_suggestions"
 * and "general_feedback". Markdown code fences around the JSON are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelResponseParser {

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ParsedEvaluation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedEvaluation.malformed("Empty model output");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(raw));
        } catch (JsonProcessingException e) {
            log.debug("Model output is not JSON: {}", e.getOriginalMessage());
            return ParsedEvaluation.malformed("Output is not valid JSON");
        }

        if (root == null || !root.isObject()) {
            return ParsedEvaluation.malformed("Output is not a JSON object");
        }

        JsonNode scoreNode = root.get("score");
        if (scoreNode == null || !scoreNode.isNumber()) {
            return ParsedEvaluation.malformed("Missing or non-numeric score");
        }

        double score = scoreNode.asDouble();
        boolean clamped = false;
        if (score < EvaluationResult.MIN_SCORE || score > EvaluationResult.MAX_SCORE) {
            score = Math.max(EvaluationResult.MIN_SCORE, Math.min(EvaluationResult.MAX_SCORE, score));
            clamped = true;
        }

        List<FeedbackItem> feedback = new ArrayList<>();
        readFeedbackList(root.get("feedback"), feedback);
        readCategory(root.get("grammar_errors"), "grammar", feedback);
        readCategory(root.get("vocabulary_suggestions"), "vocabulary", feedback);
        readCategory(root.get("general_feedback"), "general", feedback);

        return ParsedEvaluation.success(score, feedback, clamped);
    }

    /**
     * Cut the payload out of ```json ... ``` fences or surrounding chatter.
     */
    static String stripFences(String raw) {
        String text = raw.strip();
        if (text.startsWith(FENCE)) {
            int firstLineEnd = text.indexOf('\n');
            text = firstLineEnd < 0 ? text.substring(FENCE.length()) : text.substring(firstLineEnd + 1);
            int closing = text.lastIndexOf(FENCE);
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
            text = text.strip();
        }
        if (!text.startsWith("{")) {
            int open = text.indexOf('{');
            int close = text.lastIndexOf('}');
            if (open >= 0 && close > open) {
                text = text.substring(open, close + 1);
            }
        }
        return text;
    }

    private void readFeedbackList(JsonNode node, List<FeedbackItem> feedback) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isTextual()) {
            addIfPresent("general", node.asText(), feedback);
            return;
        }
        if (!node.isArray()) {
            return;
        }
        for (JsonNode item : node) {
            if (item.isTextual()) {
                addIfPresent("general", item.asText(), feedback);
            } else if (item.isObject()) {
                String category = item.path("category").asText("general");
                addIfPresent(category.isBlank() ? "general" : category, item.path("comment").asText(""), feedback);
            }
        }
    }

    private void readCategory(JsonNode node, String category, List<FeedbackItem> feedback) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                addIfPresent(category, item.isTextual() ? item.asText() : item.toString(), feedback);
            }
        } else {
            addIfPresent(category, node.isTextual() ? node.asText() : node.toString(), feedback);
        }
    }

    private void addIfPresent(String category, String comment, List<FeedbackItem> feedback) {
        if (comment != null && !comment.isBlank()) {
            feedback.add(new FeedbackItem(
                    TextNormalizer.truncate(category.strip(), FeedbackItem.MAX_CATEGORY_LENGTH),
                    TextNormalizer.truncate(comment.strip(), FeedbackItem.MAX_COMMENT_LENGTH)));
        }
    }

    /**
     * Typed model output: either a usable score with feedback or the reason
     * it was rejected.
     */
    public record ParsedEvaluation(
            boolean valid,
            Double score,
            List<FeedbackItem> feedback,
            boolean clamped,
            String reason
    ) {
        public static ParsedEvaluation success(double score, List<FeedbackItem> feedback, boolean clamped) {
            return new ParsedEvaluation(true, score, List.copyOf(feedback), clamped, null);
        }

        public static ParsedEvaluation malformed(String reason) {
            return new ParsedEvaluation(false, null, List.of(), false, reason);
        }
    }
}

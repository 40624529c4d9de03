package com.lumen.grading.service;

import org.springframework.stereotype.Component;

import com.lumen.grading.config.GradingProperties;

import lombok.RequiredArgsConstructor;

/**
 * Builds the evaluation prompts sent to the model.
 */
@Component
@RequiredArgsConstructor
public class RubricPromptBuilder {

    static final String RESPONSE_SCHEMA = """
            {
              "score": <number between 0 and 100>,
              "feedback": [
                {"category": "grammar", "comment": "<text>"},
                {"category": "vocabulary", "comment": "<text>"},
                {"category": "general", "comment": "<text>"}
              ]
            }""";

    private final GradingProperties properties;

    public String build(String extractedText, boolean strict) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(properties.getEvaluation().getRubric()).append("\n\n");
        prompt.append("Evaluate the following student submission.\n\n");
        prompt.append("Submission:\n\"\"\"\n").append(extractedText).append("\n\"\"\"\n\n");

        if (strict) {
            prompt.append("Respond with ONLY a single JSON object and nothing else: no markdown, no code fences, ")
                    .append("no explanation before or after it. The object must match this schema exactly, ")
                    .append("and \"score\" must be a number, not a string:\n")
                    .append(RESPONSE_SCHEMA);
        } else {
            prompt.append("Provide your evaluation in JSON format:\n").append(RESPONSE_SCHEMA);
        }
        return prompt.toString();
    }
}

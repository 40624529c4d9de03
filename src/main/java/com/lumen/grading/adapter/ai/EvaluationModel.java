package com.lumen.grading.adapter.ai;

import com.lumen.grading.exception.ModelUnavailableException;

/**
 * Text completion model used to evaluate student writing.
 */
public interface EvaluationModel {

    /**
     * Send a prompt and return the raw model text.
     *
     * @throws ModelUnavailableException on network errors, timeouts, rate limits or server errors
     */
    String complete(String prompt);

    /**
     * Identifier recorded on every evaluation result.
     */
    String modelId();
}

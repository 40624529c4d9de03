package com.lumen.grading.model.enums;

/**
 * Outcome of a single AI evaluation attempt.
 */
public enum EvaluationOutcome {

    SUCCESS,

    /**
     * Network error, timeout or rate limit. Retried with backoff.
     */
    TRANSIENT_FAILURE,

    /**
     * Model responded with unusable content. Retried once with a stricter prompt.
     */
    REJECTED
}

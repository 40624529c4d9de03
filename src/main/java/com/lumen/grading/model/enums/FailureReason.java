package com.lumen.grading.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reason codes surfaced to instructors when a stage fails.
 */
@Getter
@RequiredArgsConstructor
public enum FailureReason {

    /**
     * OCR produced no usable text
     */
    ILLEGIBLE("illegible", false),

    /**
     * OCR engine could not be reached or timed out
     */
    ENGINE_UNAVAILABLE("engine_unavailable", true),

    /**
     * Input was empty, corrupt or unreadable
     */
    BAD_INPUT("bad_input", false),

    /**
     * AI model could not be reached, timed out or was rate limited
     */
    MODEL_UNAVAILABLE("model_unavailable", true),

    /**
     * AI model answered, but not in the expected shape
     */
    REJECTED_OUTPUT("rejected_output", false);

    private final String code;

    private final boolean retryable;
}

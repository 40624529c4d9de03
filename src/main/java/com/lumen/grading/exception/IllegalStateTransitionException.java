package com.lumen.grading.exception;

import com.lumen.grading.model.enums.SubmissionState;

import lombok.Getter;

/**
 * Exception thrown when an operation is not allowed in the submission's
 * current lifecycle state.
 */
@Getter
public class IllegalStateTransitionException extends RuntimeException {

    private final SubmissionState currentState;

    public IllegalStateTransitionException(SubmissionState currentState, String message) {
        super(message + " (state: " + currentState + ")");
        this.currentState = currentState;
    }
}

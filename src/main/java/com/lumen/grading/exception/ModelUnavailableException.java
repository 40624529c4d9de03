package com.lumen.grading.exception;

/**
 * AI evaluation model call failed before producing an answer (network, timeout, rate limit).
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

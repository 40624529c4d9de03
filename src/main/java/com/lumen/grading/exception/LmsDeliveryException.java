package com.lumen.grading.exception;

import lombok.Getter;

/**
 * Exception thrown by an LMS connector when a grade push fails.
 *
 * Transient errors (timeouts, 5xx, 429, connection failures) are retried by
 * the sync dispatcher; the rest fail the sync job straight away.
 */
@Getter
public class LmsDeliveryException extends RuntimeException {

    /**
     * Short classification stored on the sync job, e.g. "Timeout" or "HttpStatus404".
     */
    private final String errorClass;

    private final boolean transientFailure;

    public LmsDeliveryException(String errorClass, boolean transientFailure, String message) {
        super(message);
        this.errorClass = errorClass;
        this.transientFailure = transientFailure;
    }

    public LmsDeliveryException(String errorClass, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
        this.transientFailure = transientFailure;
    }
}

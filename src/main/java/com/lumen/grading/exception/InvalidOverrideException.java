package com.lumen.grading.exception;

/**
 * Manual grade entry is out of range or not allowed for the submission.
 */
public class InvalidOverrideException extends RuntimeException {

    public InvalidOverrideException(String message) {
        super(message);
    }

    public InvalidOverrideException(String message, Throwable cause) {
        super(message, cause);
    }
}

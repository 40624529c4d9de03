package com.lumen.grading.exception;

/**
 * A PDF or Word upload could not be opened or parsed. Not retryable.
 */
public class UnreadableDocumentException extends RuntimeException {

    public UnreadableDocumentException(String message) {
        super(message);
    }

    public UnreadableDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}

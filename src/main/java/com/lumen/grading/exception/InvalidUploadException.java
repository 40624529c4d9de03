package com.lumen.grading.exception;

/**
 * Uploaded file is missing, empty, too large or of an unsupported type.
 */
public class InvalidUploadException extends RuntimeException {

    public InvalidUploadException(String message) {
        super(message);
    }

    public InvalidUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}

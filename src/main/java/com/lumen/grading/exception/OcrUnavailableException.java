package com.lumen.grading.exception;

/**
 * OCR engine could not be reached, timed out or is overloaded. Retryable.
 */
public class OcrUnavailableException extends RuntimeException {

    public OcrUnavailableException(String message) {
        super(message);
    }

    public OcrUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lumen.grading.exception;

/**
 * OCR engine rejected the image as corrupt or unsupported. Not retryable.
 */
public class UnreadableImageException extends RuntimeException {

    public UnreadableImageException(String message) {
        super(message);
    }

    public UnreadableImageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lumen.grading.exception;

/**
 * Exception thrown when a submission is not found.
 */
public class SubmissionNotFoundException extends RuntimeException {

    public SubmissionNotFoundException(Long submissionId) {
        super("Submission not found: " + submissionId);
    }
}

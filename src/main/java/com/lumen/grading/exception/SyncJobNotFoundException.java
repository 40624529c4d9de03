package com.lumen.grading.exception;

/**
 * Exception thrown when a sync job is not found.
 */
public class SyncJobNotFoundException extends RuntimeException {

    public SyncJobNotFoundException(Long jobId) {
        super("Sync job not found: " + jobId);
    }
}

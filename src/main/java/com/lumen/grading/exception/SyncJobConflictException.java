package com.lumen.grading.exception;

import com.lumen.grading.model.enums.SyncState;

import lombok.Getter;

/**
 * Exception thrown when a sync job cannot be retried in its current state.
 */
@Getter
public class SyncJobConflictException extends RuntimeException {

    private final SyncState currentState;

    public SyncJobConflictException(Long jobId, SyncState currentState) {
        super("Sync job " + jobId + " is " + currentState + "; only FAILED or DISABLED jobs can be retried");
        this.currentState = currentState;
    }
}

package com.lumen.grading.model.enums;

/**
 * Delivery state of a grade to one LMS integration.
 */
public enum SyncState {

    /**
     * Waiting for a (first or retried) delivery attempt
     */
    PENDING,

    /**
     * Acknowledged by the LMS
     */
    SENT,

    /**
     * Retries exhausted or permanent error; needs a manual re-trigger
     */
    FAILED,

    /**
     * Integration was deactivated or had sync turned off
     */
    DISABLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

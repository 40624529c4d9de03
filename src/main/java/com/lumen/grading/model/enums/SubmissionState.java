package com.lumen.grading.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submission through the grading pipeline.
 *
 * Happy path:
 *   NEW -> EXTRACTING -> EXTRACTED -> EVALUATING -> EVALUATED -> GRADED -> SYNCED
 *
 * EXTRACTION_FAILED and EVALUATION_FAILED stop automatic processing; an
 * instructor can still enter a manual grade or retry the failed stage.
 */
public enum SubmissionState {

    NEW,
    EXTRACTING,
    EXTRACTED,
    EVALUATING,
    EVALUATED,
    GRADED,
    SYNCED,
    EXTRACTION_FAILED,
    EVALUATION_FAILED,
    CANCELLED;

    /**
     * States the scheduler keeps driving forward.
     */
    public static final Set<SubmissionState> IN_PROGRESS =
            EnumSet.of(NEW, EXTRACTING, EXTRACTED, EVALUATING, EVALUATED, GRADED);

    public boolean isTerminal() {
        return this == SYNCED || this == EXTRACTION_FAILED || this == EVALUATION_FAILED || this == CANCELLED;
    }

    public boolean isFailed() {
        return this == EXTRACTION_FAILED || this == EVALUATION_FAILED;
    }

    public boolean isGradedOrLater() {
        return this == GRADED || this == SYNCED;
    }

    /**
     * Whether extracted text must be present in this state.
     */
    public boolean hasExtractedText() {
        return switch (this) {
            case EXTRACTED, EVALUATING, EVALUATED, GRADED, SYNCED, EVALUATION_FAILED -> true;
            default -> false;
        };
    }

    public boolean isCancellable() {
        return switch (this) {
            case NEW, EXTRACTING, EXTRACTED, EVALUATING, EVALUATED -> true;
            default -> false;
        };
    }

    public boolean canTransitionTo(SubmissionState next) {
        return switch (this) {
            case NEW -> next == EXTRACTING || next == CANCELLED;
            case EXTRACTING -> next == EXTRACTING || next == EXTRACTED
                    || next == EXTRACTION_FAILED || next == CANCELLED;
            case EXTRACTED -> next == EVALUATING || next == CANCELLED;
            case EVALUATING -> next == EVALUATING || next == EVALUATED
                    || next == EVALUATION_FAILED || next == CANCELLED;
            case EVALUATED -> next == GRADED || next == CANCELLED;
            case GRADED -> next == SYNCED;
            case EXTRACTION_FAILED -> next == EXTRACTING;
            case EVALUATION_FAILED -> next == EXTRACTED;
            case SYNCED, CANCELLED -> false;
        };
    }
}

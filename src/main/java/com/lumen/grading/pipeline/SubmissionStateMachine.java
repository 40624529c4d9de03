package com.lumen.grading.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.FailureReason;
import com.lumen.grading.model.enums.SubmissionState;

import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle transitions of a submission.
 *
 * Only mutates the entity it is given; persisting is the caller's job. Every
 * transition is checked against {@link SubmissionState#canTransitionTo}.
 */
@Component
@Slf4j
public class SubmissionStateMachine {

    private final Clock clock;

    public SubmissionStateMachine(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Move to {@code next} or throw if the lifecycle does not allow it.
     */
    public void moveTo(Submission submission, SubmissionState next) {
        SubmissionState current = submission.getState();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(current,
                    "Submission " + submission.getId() + " cannot move to " + next);
        }
        if (current != next) {
            log.info("PIPELINE: Submission {} {} -> {}", submission.getId(), current, next);
        }
        submission.setState(next);
    }

    /**
     * Protect a claimed stage from being claimed again while it runs.
     */
    public void lease(Submission submission, Duration lease) {
        submission.setNextAttemptAt(now().plus(lease));
        submission.setStageLeased(true);
    }

    /**
     * A leased stage whose lease ran out: the claimed call never reported back.
     */
    public boolean leaseExpired(Submission submission) {
        return submission.isStageLeased() && submission.isDue(now());
    }

    /**
     * Make the current stage claimable again right away.
     */
    public void releaseLease(Submission submission) {
        submission.setStageLeased(false);
        submission.setNextAttemptAt(null);
    }

    /**
     * Enter a new stage with fresh retry bookkeeping.
     */
    public void enterStage(Submission submission, SubmissionState next) {
        moveTo(submission, next);
        resetStageCounters(submission);
    }

    public void extractionSucceeded(Submission submission, String text) {
        submission.setExtractedText(text);
        enterStage(submission, SubmissionState.EXTRACTED);
    }

    public void evaluationSucceeded(Submission submission) {
        enterStage(submission, SubmissionState.EVALUATED);
    }

    /**
     * Record a retryable failure; either schedule another attempt or fail the stage.
     *
     * @return true if another attempt was scheduled
     */
    public boolean retryableFailure(Submission submission, RetryPolicy policy,
                                    FailureReason exhaustedReason, String detail) {
        int failures = submission.getTransientFailures() + 1;
        submission.setTransientFailures(failures);
        submission.setStageLeased(false);
        submission.recordError(detail);

        if (policy.canRetry(failures)) {
            submission.setNextAttemptAt(now().plus(policy.backoff(failures)));
            log.warn("PIPELINE: Submission {} {} failed ({}/{}), retrying at {}: {}",
                    submission.getId(), submission.getState(), failures, policy.maxAttempts(),
                    submission.getNextAttemptAt(), detail);
            return true;
        }

        fail(submission, exhaustedReason, detail);
        return false;
    }

    /**
     * Stop the current stage for good.
     */
    public void fail(Submission submission, FailureReason reason, String detail) {
        SubmissionState failedState = switch (submission.getState()) {
            case EXTRACTING -> SubmissionState.EXTRACTION_FAILED;
            case EVALUATING -> SubmissionState.EVALUATION_FAILED;
            default -> throw new IllegalStateTransitionException(submission.getState(),
                    "Submission " + submission.getId() + " has no stage to fail");
        };
        moveTo(submission, failedState);
        submission.setFailureReason(reason);
        submission.recordError(detail);
        releaseLease(submission);
        log.error("PIPELINE: Submission {} failed with {}: {}", submission.getId(), reason.getCode(), detail);
    }

    /**
     * Re-enter the stage that failed (instructor retry).
     */
    public void restartFailedStage(Submission submission) {
        SubmissionState restart = switch (submission.getState()) {
            case EXTRACTION_FAILED -> SubmissionState.EXTRACTING;
            case EVALUATION_FAILED -> SubmissionState.EXTRACTED;
            default -> throw new IllegalStateTransitionException(submission.getState(),
                    "Only failed submissions can be retried");
        };
        enterStage(submission, restart);
        submission.setFailureReason(null);
        submission.setLastError(null);
    }

    public void cancel(Submission submission) {
        if (!submission.getState().isCancellable()) {
            throw new IllegalStateTransitionException(submission.getState(),
                    "Submission " + submission.getId() + " can no longer be cancelled");
        }
        moveTo(submission, SubmissionState.CANCELLED);
        releaseLease(submission);
    }

    private void resetStageCounters(Submission submission) {
        submission.setTransientFailures(0);
        submission.setRejectedOutputs(0);
        releaseLease(submission);
    }
}

package com.lumen.grading.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.exception.SubmissionNotFoundException;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.model.enums.EvaluationOutcome;
import com.lumen.grading.model.enums.FailureReason;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.service.ContentExtractor;
import com.lumen.grading.service.ContentExtractor.ExtractionResult;
import com.lumen.grading.service.ContentExtractor.SubmissionInput;
import com.lumen.grading.service.EvaluationClient;
import com.lumen.grading.service.GradeReconciler;
import com.lumen.grading.service.GradeReconciler.ManualOverride;
import com.lumen.grading.service.SyncDispatcher;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives submissions through extraction, evaluation, grading and sync.
 *
 * A step runs in three phases: claim the work under the submission lock,
 * call the external service without the lock, apply the result under the
 * lock again. Stage failures never escape; they end up as lifecycle state
 * and a reason code on the submission.
 */
@Service
@Slf4j
public class SubmissionPipelineService {

    private static final int MAX_STEPS_PER_DRIVE = 50;

    private final SubmissionRepository submissionRepository;
    private final EvaluationResultRepository evaluationResultRepository;
    private final GradeRepository gradeRepository;
    private final ContentExtractor contentExtractor;
    private final EvaluationClient evaluationClient;
    private final GradeReconciler gradeReconciler;
    private final SyncDispatcher syncDispatcher;
    private final SubmissionStateMachine stateMachine;
    private final SubmissionLockRegistry locks;
    private final RetryPolicy extractionPolicy;
    private final RetryPolicy evaluationPolicy;
    private final int maxRejectedAttempts;
    private final Duration stageLease;

    public SubmissionPipelineService(SubmissionRepository submissionRepository,
                                     EvaluationResultRepository evaluationResultRepository,
                                     GradeRepository gradeRepository,
                                     ContentExtractor contentExtractor,
                                     EvaluationClient evaluationClient,
                                     GradeReconciler gradeReconciler,
                                     SyncDispatcher syncDispatcher,
                                     SubmissionStateMachine stateMachine,
                                     SubmissionLockRegistry locks,
                                     GradingProperties properties) {
        this.submissionRepository = submissionRepository;
        this.evaluationResultRepository = evaluationResultRepository;
        this.gradeRepository = gradeRepository;
        this.contentExtractor = contentExtractor;
        this.evaluationClient = evaluationClient;
        this.gradeReconciler = gradeReconciler;
        this.syncDispatcher = syncDispatcher;
        this.stateMachine = stateMachine;
        this.locks = locks;
        this.extractionPolicy = RetryPolicy.forExtraction(properties);
        this.evaluationPolicy = RetryPolicy.forEvaluation(properties);
        this.maxRejectedAttempts = Math.max(1, properties.getEvaluation().getMaxRejectedAttempts());
        this.stageLease = Duration.ofSeconds(properties.getPipeline().getStageLeaseSeconds());
    }

    // ========================================================================
    // AUTOMATIC PROGRESSION
    // ========================================================================

    /**
     * Run steps until the submission is terminal or has to wait.
     *
     * @return the submission as it was left
     */
    public Submission drive(Long submissionId) {
        int steps = 0;
        while (steps < MAX_STEPS_PER_DRIVE && advance(submissionId)) {
            steps++;
        }
        if (steps == MAX_STEPS_PER_DRIVE) {
            log.warn("PIPELINE: Submission {} still moving after {} steps, yielding", submissionId, steps);
        }
        return load(submissionId);
    }

    /**
     * Run one step of the pipeline if one is due.
     *
     * @return true if something happened and another step may be due
     */
    public boolean advance(Long submissionId) {
        Claim claim = locks.withSubmissionLock(submissionId, () -> claim(submissionId));

        switch (claim.kind()) {
            case EXTRACT, EVALUATE -> {
                syncDispatcher.deliverAll(runStage(submissionId, claim));
                return true;
            }
            case DELIVER -> {
                syncDispatcher.deliverAll(claim.syncJobs());
                return true;
            }
            case PROGRESSED -> {
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Call the stage's service and apply its result. Anything thrown on the
     * way counts as a retryable failure of the stage.
     */
    private List<SyncJob> runStage(Long submissionId, Claim claim) {
        try {
            if (claim.kind() == ClaimKind.EXTRACT) {
                ExtractionResult result = extractSafely(submissionId, claim.input());
                return locks.withSubmissionLock(submissionId, () -> applyExtraction(submissionId, result));
            }
            EvaluationResult result = evaluationClient.evaluate(
                    submissionId, claim.text(), claim.attemptNumber(), claim.strict());
            return locks.withSubmissionLock(submissionId, () -> applyEvaluation(submissionId, result));
        } catch (RuntimeException e) {
            log.error("PIPELINE: {} of submission {} failed: {}", claim.kind(), submissionId, e.getMessage(), e);
            return locks.withSubmissionLock(submissionId, () -> recordStageError(submissionId, claim.kind(), e));
        }
    }

    private List<SyncJob> recordStageError(Long submissionId, ClaimKind kind, RuntimeException error) {
        Submission submission = submissionRepository.findById(submissionId).orElse(null);
        SubmissionState stage = kind == ClaimKind.EXTRACT ? SubmissionState.EXTRACTING : SubmissionState.EVALUATING;
        if (submission == null || submission.getState() != stage) {
            return List.of();
        }
        stageFailure(submission, "Internal error: " + error.getMessage());
        submission = submissionRepository.save(submission);
        return enqueueManualGradeOnFailure(submission);
    }

    /**
     * Count a retryable failure against the submission's current stage.
     */
    private void stageFailure(Submission submission, String detail) {
        if (submission.getState() == SubmissionState.EXTRACTING) {
            stateMachine.retryableFailure(submission, extractionPolicy, FailureReason.ENGINE_UNAVAILABLE, detail);
        } else {
            stateMachine.retryableFailure(submission, evaluationPolicy, FailureReason.MODEL_UNAVAILABLE, detail);
        }
    }

    private Claim claim(Long submissionId) {
        Submission submission = load(submissionId);

        if (submission.getState().isTerminal() || !submission.isDue(stateMachine.now())) {
            return Claim.none();
        }

        if (stateMachine.leaseExpired(submission)) {
            log.warn("PIPELINE: Submission {} {} lease expired without a result", submissionId, submission.getState());
            stageFailure(submission, "Stage lease expired without a result");
            submission = submissionRepository.save(submission);
            List<SyncJob> jobs = enqueueManualGradeOnFailure(submission);
            return jobs.isEmpty() ? Claim.progressed() : Claim.deliver(jobs);
        }

        switch (submission.getState()) {
            case NEW -> {
                stateMachine.enterStage(submission, SubmissionState.EXTRACTING);
                return claimExtraction(submission);
            }
            case EXTRACTING -> {
                return claimExtraction(submission);
            }
            case EXTRACTED -> {
                stateMachine.moveTo(submission, SubmissionState.EVALUATING);
                return claimEvaluation(submission);
            }
            case EVALUATING -> {
                return claimEvaluation(submission);
            }
            case EVALUATED -> {
                Grade grade = gradeReconciler.reconcile(submission, activeEvaluation(submissionId), null);
                stateMachine.moveTo(submission, SubmissionState.GRADED);
                submissionRepository.save(submission);
                log.info("PIPELINE: Submission {} graded {} ({})", submissionId, grade.getFinalScore(), grade.getSource());
                return Claim.progressed();
            }
            case GRADED -> {
                Grade grade = gradeRepository.findBySubmissionId(submissionId)
                        .orElseThrow(() -> new IllegalStateException("Submission " + submissionId + " is GRADED without a grade"));
                List<SyncJob> jobs = syncDispatcher.enqueue(grade, submission.getCourseId());
                stateMachine.moveTo(submission, SubmissionState.SYNCED);
                submissionRepository.save(submission);
                return jobs.isEmpty() ? Claim.progressed() : Claim.deliver(jobs);
            }
            default -> {
                return Claim.none();
            }
        }
    }

    private Claim claimExtraction(Submission submission) {
        stateMachine.lease(submission, stageLease);
        submission = submissionRepository.save(submission);
        return Claim.extract(SubmissionInput.of(submission));
    }

    private Claim claimEvaluation(Submission submission) {
        int attemptNumber = submission.getEvaluationAttemptSeq() + 1;
        submission.setEvaluationAttemptSeq(attemptNumber);
        boolean strict = submission.getRejectedOutputs() > 0;
        stateMachine.lease(submission, stageLease);
        submission = submissionRepository.save(submission);
        return Claim.evaluate(submission.getExtractedText(), attemptNumber, strict);
    }

    private ExtractionResult extractSafely(Long submissionId, SubmissionInput input) {
        try {
            return contentExtractor.extract(input);
        } catch (Exception e) {
            log.error("PIPELINE: Extraction of submission {} crashed: {}", submissionId, e.getMessage(), e);
            return ExtractionResult.failure(FailureReason.ENGINE_UNAVAILABLE, "Extraction error: " + e.getMessage());
        }
    }

    private List<SyncJob> applyExtraction(Long submissionId, ExtractionResult result) {
        Submission submission = load(submissionId);
        if (submission.getState() != SubmissionState.EXTRACTING) {
            log.info("PIPELINE: Extraction result for submission {} dropped, state is now {}",
                    submissionId, submission.getState());
            return List.of();
        }

        if (result.success()) {
            stateMachine.extractionSucceeded(submission, result.text());
        } else if (result.retryable()) {
            stateMachine.retryableFailure(submission, extractionPolicy, FailureReason.ENGINE_UNAVAILABLE, result.detail());
        } else {
            stateMachine.fail(submission, result.failureReason(), result.detail());
        }
        submission = submissionRepository.save(submission);
        return enqueueManualGradeOnFailure(submission);
    }

    private List<SyncJob> applyEvaluation(Long submissionId, EvaluationResult result) {
        Submission submission = load(submissionId);

        if (submission.getState() != SubmissionState.EVALUATING
                || submission.getEvaluationAttemptSeq() != result.getAttemptNumber()) {
            log.info("PIPELINE: Evaluation attempt {} of submission {} is stale (state {}, latest attempt {}), discarded",
                    result.getAttemptNumber(), submissionId, submission.getState(), submission.getEvaluationAttemptSeq());
            result.setDiscarded(true);
            evaluationResultRepository.save(result);
            return List.of();
        }

        if (result.getOutcome() == EvaluationOutcome.SUCCESS) {
            stateMachine.evaluationSucceeded(submission);
        } else if (result.getOutcome() == EvaluationOutcome.REJECTED) {
            int rejected = submission.getRejectedOutputs() + 1;
            submission.setRejectedOutputs(rejected);
            if (rejected >= maxRejectedAttempts) {
                stateMachine.fail(submission, FailureReason.REJECTED_OUTPUT, result.getErrorDetail());
            } else {
                submission.recordError(result.getErrorDetail());
                stateMachine.releaseLease(submission);
                log.warn("PIPELINE: Submission {} output rejected, retrying with strict prompt", submissionId);
            }
        } else {
            stateMachine.retryableFailure(submission, evaluationPolicy, FailureReason.MODEL_UNAVAILABLE,
                    result.getErrorDetail());
        }
        submission = submissionRepository.save(submission);
        return enqueueManualGradeOnFailure(submission);
    }

    /**
     * A grade entered while the stage was running is sent out once the stage
     * has failed for good; the pipeline will not reach GRADED for it.
     */
    private List<SyncJob> enqueueManualGradeOnFailure(Submission submission) {
        if (!submission.getState().isFailed()) {
            return List.of();
        }
        return gradeRepository.findBySubmissionId(submission.getId())
                .map(grade -> syncDispatcher.enqueue(grade, submission.getCourseId()))
                .orElse(List.of());
    }

    // ========================================================================
    // INSTRUCTOR ACTIONS
    // ========================================================================

    /**
     * Store an instructor's grade. Allowed in every state except CANCELLED.
     *
     * An EVALUATED submission moves to GRADED. A synced grade is pushed again
     * to the integrations that had it. A grade entered on a failed submission
     * is sent to the course's integrations; the failed state stays. A grade
     * entered while the pipeline is still running is kept when the
     * evaluation finishes.
     */
    public Grade override(Long submissionId, ManualOverride override) {
        OverrideOutcome outcome = locks.withSubmissionLock(submissionId, () -> {
            Submission submission = load(submissionId);
            Grade grade = gradeReconciler.reconcile(submission, activeEvaluation(submissionId), override);

            List<SyncJob> jobs = List.of();
            switch (submission.getState()) {
                case EVALUATED -> {
                    stateMachine.moveTo(submission, SubmissionState.GRADED);
                    submissionRepository.save(submission);
                }
                case SYNCED -> jobs = syncDispatcher.enqueueRegrade(grade);
                case EXTRACTION_FAILED, EVALUATION_FAILED -> jobs = syncDispatcher.enqueue(grade, submission.getCourseId());
                default -> {
                    // the running pipeline picks the grade up
                }
            }
            return new OverrideOutcome(grade, jobs);
        });

        if (!outcome.syncJobs().isEmpty()) {
            syncDispatcher.deliverAll(outcome.syncJobs());
        }
        return outcome.grade();
    }

    /**
     * Stop processing of a submission that has no grade yet.
     */
    public Submission cancel(Long submissionId) {
        return locks.withSubmissionLock(submissionId, () -> {
            Submission submission = load(submissionId);
            if (gradeRepository.existsBySubmissionId(submissionId)) {
                throw new IllegalStateTransitionException(submission.getState(),
                        "Submission " + submissionId + " already has a grade");
            }
            stateMachine.cancel(submission);
            return submissionRepository.save(submission);
        });
    }

    /**
     * Re-run the stage a submission failed in, with a fresh retry budget.
     */
    public Submission retry(Long submissionId) {
        return locks.withSubmissionLock(submissionId, () -> {
            Submission submission = load(submissionId);
            if (gradeRepository.existsBySubmissionId(submissionId)) {
                throw new IllegalStateTransitionException(submission.getState(),
                        "Submission " + submissionId + " was graded manually; retry is not possible");
            }
            stateMachine.restartFailedStage(submission);
            log.info("PIPELINE: Submission {} restarted by instructor at {}", submissionId, submission.getState());
            return submissionRepository.save(submission);
        });
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private Submission load(Long submissionId) {
        return submissionRepository.findById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    private Optional<EvaluationResult> activeEvaluation(Long submissionId) {
        return evaluationResultRepository.findFirstBySubmissionIdAndOutcomeAndDiscardedFalseOrderByAttemptNumberDesc(
                submissionId, EvaluationOutcome.SUCCESS);
    }

    private record OverrideOutcome(Grade grade, List<SyncJob> syncJobs) {}

    /**
     * Work claimed under the lock, to be carried out without it.
     */
    private record Claim(
            ClaimKind kind,
            SubmissionInput input,
            String text,
            int attemptNumber,
            boolean strict,
            List<SyncJob> syncJobs
    ) {
        static Claim none() {
            return new Claim(ClaimKind.NONE, null, null, 0, false, List.of());
        }

        static Claim progressed() {
            return new Claim(ClaimKind.PROGRESSED, null, null, 0, false, List.of());
        }

        static Claim extract(SubmissionInput input) {
            return new Claim(ClaimKind.EXTRACT, input, null, 0, false, List.of());
        }

        static Claim evaluate(String text, int attemptNumber, boolean strict) {
            return new Claim(ClaimKind.EVALUATE, null, text, attemptNumber, strict, List.of());
        }

        static Claim deliver(List<SyncJob> jobs) {
            return new Claim(ClaimKind.DELIVER, null, null, 0, false, jobs);
        }
    }

    private enum ClaimKind { NONE, PROGRESSED, EXTRACT, EVALUATE, DELIVER }
}

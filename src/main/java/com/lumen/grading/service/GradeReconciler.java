package com.lumen.grading.service;

import java.util.Optional;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.exception.InvalidOverrideException;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.GradeRevision;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.GradeSource;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.GradeRevisionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides the authoritative grade of a submission from its active AI
 * evaluation and any instructor override.
 *
 * Rules:
 * <ul>
 *   <li>automatic, no grade yet: score of the evaluation, source AI</li>
 *   <li>automatic, grade already set by an instructor: grade untouched, the
 *       late evaluation is marked discarded</li>
 *   <li>override with a successful evaluation behind it: AI_OVERRIDDEN</li>
 *   <li>override without one: MANUAL</li>
 * </ul>
 * Evaluation results are never modified except for the discarded flag.
 * Callers must hold the submission lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradeReconciler {

    private final GradeRepository gradeRepository;
    private final GradeRevisionRepository revisionRepository;
    private final EvaluationResultRepository evaluationResultRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Reconcile the grade.
     *
     * @param submission       the submission being graded
     * @param activeEvaluation highest successful, non-discarded evaluation, if any
     * @param override         instructor decision, or null for automatic reconciliation
     * @return the stored grade
     */
    public Grade reconcile(Submission submission, Optional<EvaluationResult> activeEvaluation, ManualOverride override) {
        if (submission.getState() == SubmissionState.CANCELLED) {
            throw new IllegalStateTransitionException(submission.getState(),
                    "Cancelled submission " + submission.getId() + " cannot be graded");
        }

        Optional<Grade> existing = gradeRepository.findBySubmissionId(submission.getId());

        if (override == null) {
            return reconcileAutomatic(submission, activeEvaluation, existing);
        }
        return applyOverride(submission, activeEvaluation, existing, override);
    }

    private Grade reconcileAutomatic(Submission submission, Optional<EvaluationResult> activeEvaluation,
                                     Optional<Grade> existing) {
        EvaluationResult evaluation = activeEvaluation.orElseThrow(() -> new IllegalStateException(
                "Submission " + submission.getId() + " has no successful evaluation to grade from"));

        if (existing.isPresent() && existing.get().isManuallySet()) {
            log.info("GRADE: Submission {} keeps instructor grade {}; evaluation attempt {} discarded",
                    submission.getId(), existing.get().getFinalScore(), evaluation.getAttemptNumber());
            evaluation.setDiscarded(true);
            evaluationResultRepository.save(evaluation);
            return existing.get();
        }

        Grade grade = existing.orElseGet(() -> Grade.builder().submissionId(submission.getId()).build());
        if (evaluation.getId().equals(grade.getEvaluationResultId())) {
            return grade;
        }
        grade.setFinalScore(evaluation.getScore());
        grade.setSource(GradeSource.AI);
        grade.setEvaluationResultId(evaluation.getId());

        return store(submission, grade, existing.isEmpty());
    }

    private Grade applyOverride(Submission submission, Optional<EvaluationResult> activeEvaluation,
                                Optional<Grade> existing, ManualOverride override) {
        if (Double.isNaN(override.score())
                || override.score() < EvaluationResult.MIN_SCORE
                || override.score() > EvaluationResult.MAX_SCORE) {
            throw new InvalidOverrideException("Score must be between "
                    + (int) EvaluationResult.MIN_SCORE + " and " + (int) EvaluationResult.MAX_SCORE
                    + ", got " + override.score());
        }

        Grade grade = existing.orElseGet(() -> Grade.builder().submissionId(submission.getId()).build());
        grade.setFinalScore(override.score());
        grade.setSource(activeEvaluation.isPresent() ? GradeSource.AI_OVERRIDDEN : GradeSource.MANUAL);
        grade.setInstructorId(override.instructorId());
        activeEvaluation.ifPresent(evaluation -> grade.setEvaluationResultId(evaluation.getId()));
        if (override.feedback() != null && !override.feedback().isBlank()) {
            grade.setInstructorFeedback(override.feedback().strip());
        }

        log.info("GRADE: Instructor {} set submission {} to {} ({})",
                override.instructorId(), submission.getId(), override.score(), grade.getSource());
        return store(submission, grade, existing.isEmpty());
    }

    private Grade store(Submission submission, Grade grade, boolean created) {
        Grade saved = gradeRepository.save(grade);

        int revisionNumber = (int) revisionRepository.countByGradeId(saved.getId()) + 1;
        revisionRepository.save(GradeRevision.builder()
                .gradeId(saved.getId())
                .revisionNumber(revisionNumber)
                .score(saved.getFinalScore())
                .source(saved.getSource())
                .instructorId(saved.getInstructorId())
                .build());

        eventPublisher.publishEvent(new GradeReadyEvent(saved.getId(), submission.getId(),
                submission.getStudentId(), saved.getFinalScore(), saved.getSource(), created));
        return saved;
    }

    /**
     * An instructor's grading decision.
     */
    public record ManualOverride(
            double score,
            Long instructorId,
            String feedback
    ) {}
}

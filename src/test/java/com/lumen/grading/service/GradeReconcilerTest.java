package com.lumen.grading.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.exception.InvalidOverrideException;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.GradeRevision;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.EvaluationOutcome;
import com.lumen.grading.model.enums.GradeSource;
import com.lumen.grading.model.enums.InputKind;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.GradeRevisionRepository;
import com.lumen.grading.service.GradeReconciler.ManualOverride;

@ExtendWith(MockitoExtension.class)
class GradeReconcilerTest {

    @Mock
    private GradeRepository gradeRepository;

    @Mock
    private GradeRevisionRepository revisionRepository;

    @Mock
    private EvaluationResultRepository evaluationResultRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private GradeReconciler reconciler;

    @Test
    void automaticGradeTakesTheEvaluationScore() {
        Submission submission = submission(SubmissionState.EVALUATED);
        when(gradeRepository.findBySubmissionId(1L)).thenReturn(Optional.empty());
        stubSaves();

        Grade grade = reconciler.reconcile(submission, Optional.of(evaluation(72.0)), null);

        assertThat(grade.getFinalScore()).isEqualTo(72.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.AI);
        assertThat(grade.getEvaluationResultId()).isEqualTo(7L);

        ArgumentCaptor<GradeReadyEvent> event = ArgumentCaptor.forClass(GradeReadyEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().firstRevision()).isTrue();
        assertThat(event.getValue().studentId()).isEqualTo(11L);
    }

    @Test
    void overrideAfterAiGradeKeepsEvaluationAndMarksOverridden() {
        Submission submission = submission(SubmissionState.SYNCED);
        EvaluationResult evaluation = evaluation(72.0);
        Grade existing = Grade.builder().id(50L).submissionId(1L).finalScore(72.0)
                .source(GradeSource.AI).evaluationResultId(7L).build();
        when(gradeRepository.findBySubmissionId(1L)).thenReturn(Optional.of(existing));
        stubSaves();
        when(revisionRepository.countByGradeId(50L)).thenReturn(1L);

        Grade grade = reconciler.reconcile(submission, Optional.of(evaluation),
                new ManualOverride(85.0, 3L, "Better than the model thought."));

        assertThat(grade.getId()).isEqualTo(50L);
        assertThat(grade.getFinalScore()).isEqualTo(85.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.AI_OVERRIDDEN);
        assertThat(grade.getInstructorId()).isEqualTo(3L);
        assertThat(grade.getInstructorFeedback()).isEqualTo("Better than the model thought.");
        assertThat(evaluation.getScore()).isEqualTo(72.0);
        verify(evaluationResultRepository, never()).save(any());

        ArgumentCaptor<GradeRevision> revision = ArgumentCaptor.forClass(GradeRevision.class);
        verify(revisionRepository).save(revision.capture());
        assertThat(revision.getValue().getRevisionNumber()).isEqualTo(2);
        assertThat(revision.getValue().getSource()).isEqualTo(GradeSource.AI_OVERRIDDEN);
    }

    @Test
    void overrideWithoutEvaluationIsManual() {
        Submission submission = submission(SubmissionState.EXTRACTION_FAILED);
        when(gradeRepository.findBySubmissionId(1L)).thenReturn(Optional.empty());
        stubSaves();

        Grade grade = reconciler.reconcile(submission, Optional.empty(), new ManualOverride(60.0, 3L, null));

        assertThat(grade.getFinalScore()).isEqualTo(60.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.MANUAL);
        assertThat(grade.getEvaluationResultId()).isNull();
    }

    @Test
    void lateEvaluationDoesNotReplaceInstructorGrade() {
        Submission submission = submission(SubmissionState.EVALUATED);
        EvaluationResult evaluation = evaluation(40.0);
        Grade manual = Grade.builder().id(50L).submissionId(1L).finalScore(90.0).source(GradeSource.MANUAL).build();
        when(gradeRepository.findBySubmissionId(1L)).thenReturn(Optional.of(manual));

        Grade grade = reconciler.reconcile(submission, Optional.of(evaluation), null);

        assertThat(grade.getFinalScore()).isEqualTo(90.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.MANUAL);
        assertThat(evaluation.isDiscarded()).isTrue();
        verify(evaluationResultRepository).save(evaluation);
        verify(gradeRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void overrideOutsideScoreRangeIsRejected() {
        Submission submission = submission(SubmissionState.GRADED);
        when(gradeRepository.findBySubmissionId(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reconciler.reconcile(submission, Optional.empty(), new ManualOverride(101.0, 3L, null)))
                .isInstanceOf(InvalidOverrideException.class);
        assertThatThrownBy(() -> reconciler.reconcile(submission, Optional.empty(), new ManualOverride(-1.0, 3L, null)))
                .isInstanceOf(InvalidOverrideException.class);
        verify(gradeRepository, never()).save(any());
    }

    @Test
    void cancelledSubmissionCannotBeGraded() {
        Submission submission = submission(SubmissionState.CANCELLED);

        assertThatThrownBy(() -> reconciler.reconcile(submission, Optional.empty(), new ManualOverride(50.0, 3L, null)))
                .isInstanceOf(IllegalStateTransitionException.class);
    }

    private void stubSaves() {
        when(gradeRepository.save(any(Grade.class))).thenAnswer(invocation -> {
            Grade grade = invocation.getArgument(0);
            if (grade.getId() == null) {
                grade.setId(50L);
            }
            return grade;
        });
    }

    private static Submission submission(SubmissionState state) {
        return Submission.builder()
                .id(1L)
                .studentId(11L)
                .assignmentId(21L)
                .courseId(31L)
                .inputKind(InputKind.TEXT)
                .state(state)
                .build();
    }

    private static EvaluationResult evaluation(double score) {
        return EvaluationResult.builder()
                .id(7L)
                .submissionId(1L)
                .attemptNumber(1)
                .outcome(EvaluationOutcome.SUCCESS)
                .score(score)
                .build();
    }
}

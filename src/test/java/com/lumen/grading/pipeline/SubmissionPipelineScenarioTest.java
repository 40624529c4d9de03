package com.lumen.grading.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import com.lumen.grading.adapter.LmsConnector;
import com.lumen.grading.adapter.LmsConnector.GradePush;
import com.lumen.grading.adapter.LmsConnector.PushAck;
import com.lumen.grading.adapter.ai.EvaluationModel;
import com.lumen.grading.adapter.ocr.OcrEngine;
import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.exception.InvalidOverrideException;
import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.exception.ModelUnavailableException;
import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.FeedbackItem;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.model.enums.EvaluationOutcome;
import com.lumen.grading.model.enums.FailureReason;
import com.lumen.grading.model.enums.GradeSource;
import com.lumen.grading.model.enums.InputKind;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.model.enums.SyncState;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.GradeRevisionRepository;
import com.lumen.grading.repository.LmsIntegrationRepository;
import com.lumen.grading.repository.LmsStudentMappingRepository;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.repository.SyncJobRepository;
import com.lumen.grading.service.EvaluationClient;
import com.lumen.grading.service.GradeReconciler.ManualOverride;
import com.lumen.grading.service.LmsIntegrationService;
import com.lumen.grading.service.SubmissionService;
import com.lumen.grading.service.SyncDispatcher;

/**
 * End-to-end runs of the pipeline against an in-memory database, with the
 * OCR engine, the model and the LMS replaced by mocks.
 */
@SpringBootTest
@ActiveProfiles("test")
class SubmissionPipelineScenarioTest {

    private static final long STUDENT = 11L;
    private static final long ASSIGNMENT = 21L;
    private static final long COURSE = 31L;
    private static final long INSTRUCTOR = 3L;

    private static final LmsConnector CANVAS = Mockito.mock(LmsConnector.class);

    @TestConfiguration
    static class FakeLmsConfig {

        @Bean
        @Primary
        Map<LmsType, LmsConnector> testLmsConnectors() {
            return Map.of(LmsType.CANVAS, CANVAS);
        }
    }

    @MockBean
    private OcrEngine ocrEngine;

    @MockBean
    private EvaluationModel evaluationModel;

    @SpyBean
    private EvaluationClient evaluationClient;

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private SubmissionPipelineService pipelineService;

    @Autowired
    private SyncDispatcher syncDispatcher;

    @Autowired
    private LmsIntegrationService integrationService;

    @Autowired
    private SubmissionRepository submissionRepository;

    @Autowired
    private EvaluationResultRepository evaluationResultRepository;

    @Autowired
    private GradeRepository gradeRepository;

    @Autowired
    private GradeRevisionRepository revisionRepository;

    @Autowired
    private SyncJobRepository syncJobRepository;

    @Autowired
    private LmsIntegrationRepository integrationRepository;

    @Autowired
    private LmsStudentMappingRepository mappingRepository;

    @BeforeEach
    void setUp() {
        syncJobRepository.deleteAll();
        revisionRepository.deleteAll();
        gradeRepository.deleteAll();
        evaluationResultRepository.deleteAll();
        submissionRepository.deleteAll();
        mappingRepository.deleteAll();
        integrationRepository.deleteAll();

        reset(CANVAS);
        when(evaluationModel.modelId()).thenReturn("test-model");
    }

    // ========================================================================
    // SCENARIOS
    // ========================================================================

    @Test
    void typedTextIsGradedByTheModelWithoutIntegrations() {
        when(evaluationModel.complete(anyString())).thenReturn(
                "{\"score\": 72, \"feedback\": [{\"category\": \"general\", \"comment\": \"Simple but correct.\"}]}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "The cat sat on the mat.");
        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        assertThat(done.getExtractedText()).isEqualTo("The cat sat on the mat.");

        Grade grade = gradeRepository.findBySubmissionId(done.getId()).orElseThrow();
        assertThat(grade.getFinalScore()).isEqualTo(72.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.AI);
        assertThat(syncJobRepository.findByGradeIdOrderByCreatedAtAsc(grade.getId())).isEmpty();
        assertThat(revisionRepository.findByGradeIdOrderByRevisionNumberAsc(grade.getId())).hasSize(1);
    }

    @Test
    void illegibleImageFailsExtractionAndCanBeGradedManually() {
        when(ocrEngine.recognize(any())).thenReturn("~ . ~~ , ~");

        Submission created = submissionService.createUploadSubmission(STUDENT, ASSIGNMENT, COURSE,
                "scan.png", new byte[] {(byte) 0x89, 'P', 'N', 'G'});
        Submission failed = pipelineService.drive(created.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EXTRACTION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.ILLEGIBLE);
        assertThat(failed.getExtractedText()).isNull();
        verify(evaluationModel, never()).complete(anyString());

        Grade grade = submissionService.overrideGrade(created.getId(), new ManualOverride(60.0, INSTRUCTOR, null));

        assertThat(grade.getFinalScore()).isEqualTo(60.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.MANUAL);
        assertThat(submissionRepository.findById(created.getId()).orElseThrow().getState())
                .isEqualTo(SubmissionState.EXTRACTION_FAILED);
    }

    @Test
    void modelTimingOutThreeTimesFailsEvaluation() {
        when(evaluationModel.complete(anyString())).thenThrow(new ModelUnavailableException("timed out"));

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "An essay about rivers.");
        Submission failed = pipelineService.drive(created.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EVALUATION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.MODEL_UNAVAILABLE);
        assertThat(gradeRepository.existsBySubmissionId(created.getId())).isFalse();

        List<EvaluationResult> attempts = evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId());
        assertThat(attempts).extracting(EvaluationResult::getAttemptNumber).containsExactly(1, 2, 3);
        assertThat(attempts).extracting(EvaluationResult::getOutcome).containsOnly(EvaluationOutcome.TRANSIENT_FAILURE);
    }

    @Test
    void overrideAfterSyncSendsTheNewScoreAgain() {
        LmsIntegration canvas = integrationService.create(LmsType.CANVAS, "English 101 Canvas", COURSE,
                "4242", "http://canvas.invalid", "canvas-token");
        integrationService.mapStudent(canvas.getId(), STUDENT, "SIS-11");
        when(CANVAS.pushGrade(any(), any())).thenReturn(new PushAck("1", "ok"));
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 72}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "The cat sat on the mat.");
        pipelineService.drive(created.getId());

        Grade aiGrade = gradeRepository.findBySubmissionId(created.getId()).orElseThrow();
        List<SyncJob> firstJobs = syncJobRepository.findByGradeIdOrderByCreatedAtAsc(aiGrade.getId());
        assertThat(firstJobs).hasSize(1);
        assertThat(firstJobs.get(0).getState()).isEqualTo(SyncState.SENT);

        Grade overridden = submissionService.overrideGrade(created.getId(), new ManualOverride(85.0, INSTRUCTOR, "Nice."));

        assertThat(overridden.getSource()).isEqualTo(GradeSource.AI_OVERRIDDEN);
        List<SyncJob> jobs = syncJobRepository.findByGradeIdOrderByCreatedAtAsc(aiGrade.getId());
        assertThat(jobs).hasSize(2);
        assertThat(jobs.get(1).getIntegrationId()).isEqualTo(canvas.getId());
        assertThat(jobs.get(1).getScore()).isEqualTo(85.0);
        assertThat(jobs.get(1).getState()).isEqualTo(SyncState.SENT);
        verify(CANVAS).pushGrade(any(), eq(new GradePush("4242", "SIS-11", ASSIGNMENT, 85.0)));

        List<EvaluationResult> evaluations = evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId());
        assertThat(evaluations).hasSize(1);
        assertThat(evaluations.get(0).getScore()).isEqualTo(72.0);
        assertThat(submissionRepository.findById(created.getId()).orElseThrow().getState())
                .isEqualTo(SubmissionState.SYNCED);
    }

    // ========================================================================
    // PROPERTIES AND EDGE CASES
    // ========================================================================

    @Test
    void syncFailuresNeverTouchSubmissionOrGrade() {
        LmsIntegration canvas = integrationService.create(LmsType.CANVAS, "Flaky Canvas", COURSE,
                "4242", "http://canvas.invalid", "canvas-token");
        integrationService.mapStudent(canvas.getId(), STUDENT, "SIS-11");
        when(CANVAS.pushGrade(any(), any())).thenThrow(new LmsDeliveryException("HttpStatus503", true, "down"));
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 72}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "The cat sat on the mat.");
        pipelineService.drive(created.getId());
        Grade grade = gradeRepository.findBySubmissionId(created.getId()).orElseThrow();
        SyncJob job = syncJobRepository.findByGradeIdOrderByCreatedAtAsc(grade.getId()).get(0);
        assertThat(job.getState()).isEqualTo(SyncState.PENDING);

        syncDispatcher.deliver(job.getId());
        SyncJob failed = syncDispatcher.deliver(job.getId());

        assertThat(failed.getState()).isEqualTo(SyncState.FAILED);
        assertThat(failed.getAttemptCount()).isEqualTo(3);
        Grade after = gradeRepository.findById(grade.getId()).orElseThrow();
        assertThat(after.getFinalScore()).isEqualTo(72.0);
        assertThat(after.getVersion()).isEqualTo(grade.getVersion());
        assertThat(submissionRepository.findById(created.getId()).orElseThrow().getState())
                .isEqualTo(SubmissionState.SYNCED);
    }

    @Test
    void unmappedStudentFailsTheSyncJob() {
        integrationService.create(LmsType.CANVAS, "Unmapped Canvas", COURSE, "4242", "http://canvas.invalid", "canvas-token");
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 50}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "Some text here.");
        pipelineService.drive(created.getId());

        Grade grade = gradeRepository.findBySubmissionId(created.getId()).orElseThrow();
        SyncJob job = syncJobRepository.findByGradeIdOrderByCreatedAtAsc(grade.getId()).get(0);
        assertThat(job.getState()).isEqualTo(SyncState.FAILED);
        assertThat(job.getLastErrorClass()).isEqualTo(SyncDispatcher.UNMAPPED_STUDENT);
        verify(CANVAS, never()).pushGrade(any(), any());
    }

    @Test
    void rejectedOutputIsRetriedWithTheStrictPrompt() {
        when(evaluationModel.complete(anyString())).thenReturn("Great essay, I'd say about a B.", "{\"score\": 81}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "My essay.");
        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        List<EvaluationResult> attempts = evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId());
        assertThat(attempts).extracting(EvaluationResult::getOutcome)
                .containsExactly(EvaluationOutcome.REJECTED, EvaluationOutcome.SUCCESS);
        assertThat(attempts).extracting(EvaluationResult::isStrictPrompt).containsExactly(false, true);
        assertThat(gradeRepository.findBySubmissionId(created.getId()).orElseThrow().getFinalScore()).isEqualTo(81.0);
    }

    @Test
    void repeatedlyRejectedOutputFailsEvaluation() {
        when(evaluationModel.complete(anyString())).thenReturn("no idea");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "My essay.");
        Submission failed = pipelineService.drive(created.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EVALUATION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.REJECTED_OUTPUT);
        assertThat(evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId())).hasSize(2);
    }

    @Test
    void retryAfterFailureContinuesAttemptNumbering() {
        when(evaluationModel.complete(anyString()))
                .thenThrow(new ModelUnavailableException("down"))
                .thenThrow(new ModelUnavailableException("down"))
                .thenThrow(new ModelUnavailableException("down"))
                .thenReturn("{\"score\": 66}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "An essay.");
        pipelineService.drive(created.getId());

        Submission restarted = submissionService.retry(created.getId());
        assertThat(restarted.getState()).isEqualTo(SubmissionState.EXTRACTED);
        assertThat(restarted.getFailureReason()).isNull();

        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        assertThat(evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId()))
                .extracting(EvaluationResult::getAttemptNumber)
                .containsExactly(1, 2, 3, 4);
    }

    @Test
    void blankTextIsBadInput() {
        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "   ");
        Submission failed = pipelineService.drive(created.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EXTRACTION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.BAD_INPUT);
    }

    @Test
    void cancellationOnlyBeforeGrading() {
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 72}");

        Submission pending = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "Cancel me.");
        assertThat(submissionService.cancel(pending.getId()).getState()).isEqualTo(SubmissionState.CANCELLED);
        assertThat(pipelineService.drive(pending.getId()).getState()).isEqualTo(SubmissionState.CANCELLED);
        assertThatThrownBy(() -> submissionService.overrideGrade(pending.getId(), new ManualOverride(50.0, INSTRUCTOR, null)))
                .isInstanceOf(IllegalStateTransitionException.class);

        Submission graded = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "Grade me.");
        pipelineService.drive(graded.getId());
        assertThatThrownBy(() -> submissionService.cancel(graded.getId()))
                .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void overrideOutsideRangeIsRejected() {
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 72}");
        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "Some text here.");
        pipelineService.drive(created.getId());

        assertThatThrownBy(() -> submissionService.overrideGrade(created.getId(), new ManualOverride(120.0, INSTRUCTOR, null)))
                .isInstanceOf(InvalidOverrideException.class);
        assertThat(gradeRepository.findBySubmissionId(created.getId()).orElseThrow().getFinalScore()).isEqualTo(72.0);
    }

    @Test
    void overrideWhileEvaluationPendingIsKept() {
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 40}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "Some text here.");
        Grade manual = submissionService.overrideGrade(created.getId(), new ManualOverride(90.0, INSTRUCTOR, null));
        assertThat(manual.getSource()).isEqualTo(GradeSource.MANUAL);

        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        Grade grade = gradeRepository.findBySubmissionId(created.getId()).orElseThrow();
        assertThat(grade.getFinalScore()).isEqualTo(90.0);
        assertThat(grade.getSource()).isEqualTo(GradeSource.MANUAL);
        List<EvaluationResult> evaluations = evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId());
        assertThat(evaluations).hasSize(1);
        assertThat(evaluations.get(0).isDiscarded()).isTrue();
    }

    @Test
    void overlongFeedbackIsStoredCut() {
        String category = "c".repeat(60);
        String comment = "x".repeat(2500);
        when(evaluationModel.complete(anyString())).thenReturn(
                "{\"score\": 64, \"feedback\": [{\"category\": \"" + category + "\", \"comment\": \"" + comment + "\"}]}");

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "A long essay.");
        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        List<EvaluationResult> attempts = evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(created.getId());
        assertThat(attempts).hasSize(1);
        FeedbackItem item = attempts.get(0).getFeedback().get(0);
        assertThat(item.getCategory()).hasSize(FeedbackItem.MAX_CATEGORY_LENGTH);
        assertThat(item.getComment()).hasSize(FeedbackItem.MAX_COMMENT_LENGTH);
    }

    @Test
    void overlongOcrTextIsCutAndGraded() {
        when(ocrEngine.recognize(any())).thenReturn("word ".repeat(5000));
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 70}");

        Submission created = submissionService.createUploadSubmission(STUDENT, ASSIGNMENT, COURSE,
                "scan.png", new byte[] {(byte) 0x89, 'P', 'N', 'G'});
        Submission done = pipelineService.drive(created.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        assertThat(done.getExtractedText()).hasSize(Submission.MAX_TEXT_LENGTH);
    }

    @Test
    void wordDocumentIsReadAndGraded() throws IOException {
        byte[] docx;
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("Rivers");
            document.createParagraph().createRun().setText("Rivers carry water to the sea.");
            document.write(out);
            docx = out.toByteArray();
        }
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 77}");

        Submission created = submissionService.createUploadSubmission(STUDENT, ASSIGNMENT, COURSE, "essay.docx", docx);
        Submission done = pipelineService.drive(created.getId());

        assertThat(created.getInputKind()).isEqualTo(InputKind.DOCUMENT);
        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        assertThat(done.getExtractedText()).isEqualTo("Rivers\nRivers carry water to the sea.");
        verify(ocrEngine, never()).recognize(any());
    }

    @Test
    void errorWhileApplyingResultCountsAsFailedAttempt() {
        doThrow(new DataIntegrityViolationException("value too long"))
                .when(evaluationClient).evaluate(anyLong(), anyString(), anyInt(), anyBoolean());

        Submission created = submissionService.createTextSubmission(STUDENT, ASSIGNMENT, COURSE, "An essay.");
        Submission failed = pipelineService.drive(created.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EVALUATION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.MODEL_UNAVAILABLE);
        assertThat(failed.getEvaluationAttemptSeq()).isEqualTo(3);
        assertThat(failed.isStageLeased()).isFalse();
        assertThat(failed.getLastError()).contains("value too long");
    }

    @Test
    void expiredLeaseCountsAsFailedAttempt() {
        Submission stuck = submissionRepository.save(Submission.builder()
                .studentId(STUDENT)
                .assignmentId(ASSIGNMENT)
                .courseId(COURSE)
                .inputKind(InputKind.TEXT)
                .rawText("An essay.")
                .extractedText("An essay.")
                .state(SubmissionState.EVALUATING)
                .evaluationAttemptSeq(3)
                .transientFailures(2)
                .stageLeased(true)
                .nextAttemptAt(LocalDateTime.now().minusMinutes(10))
                .build());

        Submission failed = pipelineService.drive(stuck.getId());

        assertThat(failed.getState()).isEqualTo(SubmissionState.EVALUATION_FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(FailureReason.MODEL_UNAVAILABLE);
        assertThat(failed.getLastError()).isEqualTo("Stage lease expired without a result");
        verify(evaluationModel, never()).complete(anyString());
    }

    @Test
    void expiredLeaseWithBudgetLeftIsClaimedAgain() {
        when(evaluationModel.complete(anyString())).thenReturn("{\"score\": 58}");
        Submission stuck = submissionRepository.save(Submission.builder()
                .studentId(STUDENT)
                .assignmentId(ASSIGNMENT)
                .courseId(COURSE)
                .inputKind(InputKind.TEXT)
                .rawText("An essay.")
                .extractedText("An essay.")
                .state(SubmissionState.EVALUATING)
                .evaluationAttemptSeq(1)
                .stageLeased(true)
                .nextAttemptAt(LocalDateTime.now().minusMinutes(10))
                .build());

        Submission done = pipelineService.drive(stuck.getId());

        assertThat(done.getState()).isEqualTo(SubmissionState.SYNCED);
        assertThat(evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(stuck.getId()))
                .extracting(EvaluationResult::getAttemptNumber)
                .containsExactly(2);
    }
}

package com.lumen.grading.service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.InvalidUploadException;
import com.lumen.grading.exception.SubmissionNotFoundException;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.dto.EvaluationResultDTO;
import com.lumen.grading.model.dto.GradeDTO;
import com.lumen.grading.model.dto.GradeRevisionDTO;
import com.lumen.grading.model.dto.SubmissionStatusDTO;
import com.lumen.grading.model.dto.SyncJobDTO;
import com.lumen.grading.model.enums.InputKind;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.pipeline.PipelineWorker;
import com.lumen.grading.pipeline.SubmissionPipelineService;
import com.lumen.grading.repository.EvaluationResultRepository;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.GradeRevisionRepository;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.repository.SyncJobRepository;
import com.lumen.grading.service.GradeReconciler.ManualOverride;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for everything the API does with submissions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    private final SubmissionRepository submissionRepository;
    private final EvaluationResultRepository evaluationResultRepository;
    private final GradeRepository gradeRepository;
    private final GradeRevisionRepository revisionRepository;
    private final SyncJobRepository syncJobRepository;
    private final SubmissionPipelineService pipelineService;
    private final PipelineWorker pipelineWorker;
    private final UploadStore uploadStore;
    private final GradingProperties properties;

    // ========================================================================
    // CREATION
    // ========================================================================

    public Submission createTextSubmission(Long studentId, Long assignmentId, Long courseId, String text) {
        if (text != null && text.length() > Submission.MAX_TEXT_LENGTH) {
            throw new InvalidUploadException("Text exceeds " + Submission.MAX_TEXT_LENGTH + " characters");
        }
        Submission submission = submissionRepository.save(Submission.builder()
                .studentId(studentId)
                .assignmentId(assignmentId)
                .courseId(courseId)
                .inputKind(InputKind.TEXT)
                .rawText(text)
                .build());

        log.info("Created text submission {} for student {} (assignment {})", submission.getId(), studentId, assignmentId);
        kick(submission.getId());
        return submission;
    }

    /**
     * Create a submission from an uploaded file: .txt files are read as typed
     * text, images go through OCR, PDF and Word documents are read from their
     * text (PDF pages without a text layer go through OCR).
     */
    public Submission createUploadSubmission(Long studentId, Long assignmentId, Long courseId,
                                             String filename, byte[] content) {
        if (UploadStore.isText(filename)) {
            uploadStore.checkSize(content);
            return createTextSubmission(studentId, assignmentId, courseId, decodeText(content));
        }
        InputKind kind;
        if (UploadStore.isImage(filename)) {
            kind = InputKind.IMAGE;
        } else if (UploadStore.isDocument(filename)) {
            kind = InputKind.DOCUMENT;
        } else {
            throw new InvalidUploadException("Unsupported file type: " + filename + " (allowed: " + allowedTypes() + ")");
        }

        String uploadRef = uploadStore.store(filename, content);
        Submission submission = submissionRepository.save(Submission.builder()
                .studentId(studentId)
                .assignmentId(assignmentId)
                .courseId(courseId)
                .inputKind(kind)
                .uploadRef(uploadRef)
                .build());

        log.info("Created {} submission {} for student {} (assignment {})",
                kind.name().toLowerCase(Locale.ROOT), submission.getId(), studentId, assignmentId);
        kick(submission.getId());
        return submission;
    }

    private static String allowedTypes() {
        return Stream.of(UploadStore.TEXT_EXTENSIONS, UploadStore.IMAGE_EXTENSIONS, UploadStore.DOCUMENT_EXTENSIONS)
                .flatMap(Set::stream)
                .sorted()
                .collect(Collectors.joining(", "));
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Transactional(readOnly = true)
    public SubmissionStatusDTO getStatus(Long submissionId) {
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> new SubmissionNotFoundException(submissionId));

        SubmissionStatusDTO status = SubmissionStatusDTO.fromEntity(submission);
        gradeRepository.findBySubmissionId(submissionId).ifPresent(grade -> {
            status.setGrade(GradeDTO.fromEntity(grade));
            status.setSyncJobs(syncJobRepository.findByGradeIdOrderByCreatedAtAsc(grade.getId()).stream()
                    .map(SyncJobDTO::fromEntity)
                    .toList());
        });
        return status;
    }

    @Transactional(readOnly = true)
    public List<EvaluationResultDTO> listEvaluations(Long submissionId) {
        requireExists(submissionId);
        return evaluationResultRepository.findBySubmissionIdOrderByAttemptNumberAsc(submissionId).stream()
                .map(EvaluationResultDTO::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<GradeRevisionDTO> gradeHistory(Long submissionId) {
        requireExists(submissionId);
        return gradeRepository.findBySubmissionId(submissionId)
                .map(grade -> revisionRepository.findByGradeIdOrderByRevisionNumberAsc(grade.getId()).stream()
                        .map(GradeRevisionDTO::fromEntity)
                        .toList())
                .orElse(List.of());
    }

    public List<SubmissionStatusDTO> listForStudent(Long studentId) {
        return submissionRepository.findByStudentIdOrderByCreatedAtDesc(studentId).stream()
                .map(SubmissionStatusDTO::fromEntity)
                .toList();
    }

    /**
     * Submissions stopped in a failed state, waiting for an instructor.
     */
    public List<SubmissionStatusDTO> listAwaitingInstructor() {
        return submissionRepository.findByStateInOrderByUpdatedAtDesc(
                        EnumSet.of(SubmissionState.EXTRACTION_FAILED, SubmissionState.EVALUATION_FAILED)).stream()
                .map(SubmissionStatusDTO::fromEntity)
                .toList();
    }

    // ========================================================================
    // INSTRUCTOR ACTIONS
    // ========================================================================

    public Grade overrideGrade(Long submissionId, ManualOverride override) {
        Grade grade = pipelineService.override(submissionId, override);
        kick(submissionId);
        return grade;
    }

    public Submission cancel(Long submissionId) {
        return pipelineService.cancel(submissionId);
    }

    public Submission retry(Long submissionId) {
        Submission submission = pipelineService.retry(submissionId);
        kick(submissionId);
        return submission;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void kick(Long submissionId) {
        if (properties.getPipeline().isDispatchOnCreate()) {
            pipelineWorker.process(submissionId);
        }
    }

    private void requireExists(Long submissionId) {
        if (!submissionRepository.existsById(submissionId)) {
            throw new SubmissionNotFoundException(submissionId);
        }
    }

    /**
     * UTF-8 if the bytes are valid UTF-8, ISO-8859-1 otherwise.
     */
    static String decodeText(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Uploaded text is not UTF-8, reading as ISO-8859-1");
            return new String(content, StandardCharsets.ISO_8859_1);
        }
    }
}

package com.lumen.grading.controller.api;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.lumen.grading.exception.InvalidUploadException;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.dto.EvaluationResultDTO;
import com.lumen.grading.model.dto.GradeDTO;
import com.lumen.grading.model.dto.GradeRevisionDTO;
import com.lumen.grading.model.dto.SubmissionStatusDTO;
import com.lumen.grading.service.GradeReconciler.ManualOverride;
import com.lumen.grading.service.SubmissionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for submissions and their grades.
 */
@RestController
@RequestMapping("/api/v1/grading/submissions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Submissions", description = "Submit work, follow its grading and grade it manually")
public class SubmissionController {

    private final SubmissionService submissionService;

    @PostMapping
    @Operation(summary = "Submit text", description = "Create a submission from typed text")
    @ApiResponse(responseCode = "201", description = "Submission created")
    public ResponseEntity<SubmissionStatusDTO> submitText(@Valid @RequestBody TextSubmissionRequest request) {
        Submission submission = submissionService.createTextSubmission(
                request.studentId(), request.assignmentId(), request.courseId(), request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionStatusDTO.fromEntity(submission));
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload work", description = "Create a submission from an image (jpg, png, gif) or a .txt file")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Submission created"),
        @ApiResponse(responseCode = "400", description = "Missing, empty or unsupported file")
    })
    public ResponseEntity<SubmissionStatusDTO> upload(
            @RequestParam Long studentId,
            @RequestParam Long assignmentId,
            @RequestParam Long courseId,
            @RequestPart("file") MultipartFile file) {

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new InvalidUploadException("Could not read uploaded file", e);
        }

        Submission submission = submissionService.createUploadSubmission(
                studentId, assignmentId, courseId, file.getOriginalFilename(), content);
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionStatusDTO.fromEntity(submission));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get submission status", description = "Lifecycle state, failure reason, grade and sync jobs")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Submission found"),
        @ApiResponse(responseCode = "404", description = "Submission not found")
    })
    public ResponseEntity<SubmissionStatusDTO> getStatus(@PathVariable Long id) {
        return ResponseEntity.ok(submissionService.getStatus(id));
    }

    @GetMapping("/{id}/evaluations")
    @Operation(summary = "List evaluation attempts", description = "Every AI evaluation attempt, oldest first")
    public ResponseEntity<List<EvaluationResultDTO>> listEvaluations(@PathVariable Long id) {
        return ResponseEntity.ok(submissionService.listEvaluations(id));
    }

    @GetMapping("/{id}/grade/history")
    @Operation(summary = "Grade history", description = "Every value the grade has held")
    public ResponseEntity<List<GradeRevisionDTO>> gradeHistory(@PathVariable Long id) {
        return ResponseEntity.ok(submissionService.gradeHistory(id));
    }

    @GetMapping("/student/{studentId}")
    @Operation(summary = "List a student's submissions")
    public ResponseEntity<List<SubmissionStatusDTO>> listForStudent(@PathVariable Long studentId) {
        return ResponseEntity.ok(submissionService.listForStudent(studentId));
    }

    @GetMapping("/awaiting-instructor")
    @Operation(summary = "List failed submissions", description = "Submissions that need a manual grade or a retry")
    public ResponseEntity<List<SubmissionStatusDTO>> listAwaitingInstructor() {
        return ResponseEntity.ok(submissionService.listAwaitingInstructor());
    }

    @PutMapping("/{id}/grade")
    @Operation(summary = "Set grade manually", description = "Enter or adjust the grade; the AI evaluation is kept")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Grade stored"),
        @ApiResponse(responseCode = "400", description = "Score outside 0-100"),
        @ApiResponse(responseCode = "409", description = "Submission was cancelled")
    })
    public ResponseEntity<GradeDTO> overrideGrade(@PathVariable Long id, @Valid @RequestBody GradeOverrideRequest request) {
        Grade grade = submissionService.overrideGrade(id,
                new ManualOverride(request.score(), request.instructorId(), request.feedback()));
        return ResponseEntity.ok(GradeDTO.fromEntity(grade));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a submission", description = "Only possible before a grade exists")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Submission cancelled"),
        @ApiResponse(responseCode = "409", description = "Submission is graded or finished")
    })
    public ResponseEntity<SubmissionStatusDTO> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(SubmissionStatusDTO.fromEntity(submissionService.cancel(id)));
    }

    @PostMapping("/{id}/retry")
    @Operation(summary = "Retry a failed stage", description = "Restart extraction or evaluation with a fresh retry budget")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Stage restarted"),
        @ApiResponse(responseCode = "409", description = "Submission is not in a failed state")
    })
    public ResponseEntity<SubmissionStatusDTO> retry(@PathVariable Long id) {
        return ResponseEntity.ok(SubmissionStatusDTO.fromEntity(submissionService.retry(id)));
    }

    // ========================================================================
    // REQUEST TYPES
    // ========================================================================

    public record TextSubmissionRequest(
            @NotNull Long studentId,
            @NotNull Long assignmentId,
            @NotNull Long courseId,
            String text
    ) {}

    public record GradeOverrideRequest(
            @NotNull Double score,
            Long instructorId,
            String feedback
    ) {}
}

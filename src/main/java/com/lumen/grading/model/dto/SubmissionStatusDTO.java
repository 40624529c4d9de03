package com.lumen.grading.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.InputKind;
import com.lumen.grading.model.enums.SubmissionState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lifecycle view of a submission, with its grade and sync jobs when present.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionStatusDTO {

    private Long id;
    private Long studentId;
    private Long assignmentId;
    private Long courseId;
    private InputKind inputKind;
    private SubmissionState state;

    /**
     * Reason code of a failed stage, e.g. "illegible" or "model_unavailable".
     */
    private String failureReason;

    private String lastError;
    private String extractedText;
    private int transientFailures;
    private LocalDateTime nextAttemptAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    private GradeDTO grade;

    private List<SyncJobDTO> syncJobs;

    public static SubmissionStatusDTO fromEntity(Submission submission) {
        return SubmissionStatusDTO.builder()
                .id(submission.getId())
                .studentId(submission.getStudentId())
                .assignmentId(submission.getAssignmentId())
                .courseId(submission.getCourseId())
                .inputKind(submission.getInputKind())
                .state(submission.getState())
                .failureReason(submission.getFailureReason() != null ? submission.getFailureReason().getCode() : null)
                .lastError(submission.getLastError())
                .extractedText(submission.getExtractedText())
                .transientFailures(submission.getTransientFailures())
                .nextAttemptAt(submission.getNextAttemptAt())
                .createdAt(submission.getCreatedAt())
                .updatedAt(submission.getUpdatedAt())
                .syncJobs(List.of())
                .build();
    }
}

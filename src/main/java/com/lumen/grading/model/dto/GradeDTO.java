package com.lumen.grading.model.dto;

import java.time.LocalDateTime;

import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.enums.GradeSource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a grade.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradeDTO {

    private Long id;

    private Long submissionId;

    private Double finalScore;

    private GradeSource source;

    /**
     * Evaluation the score derives from (null for purely manual grades).
     */
    private Long evaluationResultId;

    private Long instructorId;

    private String instructorFeedback;

    private LocalDateTime updatedAt;

    public static GradeDTO fromEntity(Grade grade) {
        return GradeDTO.builder()
                .id(grade.getId())
                .submissionId(grade.getSubmissionId())
                .finalScore(grade.getFinalScore())
                .source(grade.getSource())
                .evaluationResultId(grade.getEvaluationResultId())
                .instructorId(grade.getInstructorId())
                .instructorFeedback(grade.getInstructorFeedback())
                .updatedAt(grade.getUpdatedAt())
                .build();
    }
}

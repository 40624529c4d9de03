package com.lumen.grading.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.domain.FeedbackItem;
import com.lumen.grading.model.enums.EvaluationOutcome;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for one evaluation attempt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResultDTO {

    private Long id;
    private int attemptNumber;
    private EvaluationOutcome outcome;
    private Double score;
    private boolean scoreClamped;
    private List<FeedbackItem> feedback;
    private String modelId;
    private boolean strictPrompt;
    private String errorDetail;
    private boolean discarded;
    private LocalDateTime createdAt;

    public static EvaluationResultDTO fromEntity(EvaluationResult result) {
        return EvaluationResultDTO.builder()
                .id(result.getId())
                .attemptNumber(result.getAttemptNumber())
                .outcome(result.getOutcome())
                .score(result.getScore())
                .scoreClamped(result.isScoreClamped())
                .feedback(List.copyOf(result.getFeedback()))
                .modelId(result.getModelId())
                .strictPrompt(result.isStrictPrompt())
                .errorDetail(result.getErrorDetail())
                .discarded(result.isDiscarded())
                .createdAt(result.getCreatedAt())
                .build();
    }
}

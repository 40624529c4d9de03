package com.lumen.grading.model.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.lumen.grading.model.enums.EvaluationOutcome;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of one AI evaluation attempt.
 *
 * Every attempt is stored, failed ones included. Instructor overrides never
 * touch these rows; the only later change is marking a superseded attempt as
 * discarded.
 */
@Entity
@Table(name = "evaluation_results",
    uniqueConstraints = @UniqueConstraint(name = "uk_eval_attempt", columnNames = {"submission_id", "attempt_number"}),
    indexes = {
        @Index(name = "idx_eval_submission", columnList = "submission_id"),
        @Index(name = "idx_eval_outcome", columnList = "outcome")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResult {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false)
    private Long submissionId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private EvaluationOutcome outcome;

    /**
     * Score in [0, 100]; null unless the outcome is SUCCESS.
     */
    @Column(name = "score")
    private Double score;

    /**
     * The model returned a score out of range and it was clamped.
     */
    @Column(name = "score_clamped", nullable = false)
    @Builder.Default
    private boolean scoreClamped = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "evaluation_feedback", joinColumns = @JoinColumn(name = "evaluation_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<FeedbackItem> feedback = new ArrayList<>();

    @Column(name = "model_id", length = 100)
    private String modelId;

    /**
     * Attempt used the strict JSON-only prompt.
     */
    @Column(name = "strict_prompt", nullable = false)
    @Builder.Default
    private boolean strictPrompt = false;

    @Column(name = "error_detail", length = 500)
    private String errorDetail;

    /**
     * Completed after a newer attempt or an instructor decision; kept for
     * audit, never applied.
     */
    @Column(name = "discarded", nullable = false)
    @Builder.Default
    private boolean discarded = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    public boolean isSuccessful() {
        return outcome == EvaluationOutcome.SUCCESS;
    }
}

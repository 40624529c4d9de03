package com.lumen.grading.model.domain;

import java.time.LocalDateTime;

import com.lumen.grading.model.enums.FailureReason;
import com.lumen.grading.model.enums.InputKind;
import com.lumen.grading.model.enums.SubmissionState;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One unit of student work moving through the grading pipeline.
 *
 * Only the pipeline's state transitions mutate this record. Retry
 * bookkeeping (failure counters, next eligible attempt) is stored here so
 * that retries survive a restart.
 */
@Entity
@Table(name = "submissions", indexes = {
    @Index(name = "idx_sub_state_next", columnList = "state, next_attempt_at"),
    @Index(name = "idx_sub_student", columnList = "student_id"),
    @Index(name = "idx_sub_course", columnList = "course_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Submission {

    /**
     * Longest typed or extracted text a submission holds.
     */
    public static final int MAX_TEXT_LENGTH = 20000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @NotNull
    @Column(name = "assignment_id", nullable = false)
    private Long assignmentId;

    /**
     * Course the assignment belongs to; selects the LMS integrations.
     */
    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "input_kind", nullable = false, length = 10)
    private InputKind inputKind;

    /**
     * Typed text as submitted (TEXT input only).
     */
    @Column(name = "raw_text", length = MAX_TEXT_LENGTH)
    private String rawText;

    /**
     * Upload store reference of the image or document (IMAGE and DOCUMENT input).
     */
    @Column(name = "upload_ref", length = 100)
    private String uploadRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    @Builder.Default
    private SubmissionState state = SubmissionState.NEW;

    /**
     * Null until extraction succeeds.
     */
    @Column(name = "extracted_text", length = MAX_TEXT_LENGTH)
    private String extractedText;

    /**
     * Consecutive retryable failures in the current stage.
     */
    @Column(name = "transient_failures", nullable = false)
    @Builder.Default
    private int transientFailures = 0;

    /**
     * Rejected model outputs in the current evaluation stage.
     */
    @Column(name = "rejected_outputs", nullable = false)
    @Builder.Default
    private int rejectedOutputs = 0;

    /**
     * Highest evaluation attempt number handed out for this submission.
     */
    @Column(name = "evaluation_attempt_seq", nullable = false)
    @Builder.Default
    private int evaluationAttemptSeq = 0;

    /**
     * Earliest time the scheduler may work on this submission again.
     * Null means "now".
     */
    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    /**
     * True while a claimed stage call is out. Still true once
     * {@link #nextAttemptAt} has passed means the call never reported back.
     */
    @Column(name = "stage_leased", nullable = false)
    @Builder.Default
    private boolean stageLeased = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 30)
    private FailureReason failureReason;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Check if the scheduler may pick this submission up.
     */
    public boolean isDue(LocalDateTime now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    public void recordError(String error) {
        this.lastError = error != null ? error.substring(0, Math.min(error.length(), 500)) : null;
    }
}

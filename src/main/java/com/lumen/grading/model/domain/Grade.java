package com.lumen.grading.model.domain;

import java.time.LocalDateTime;

import com.lumen.grading.model.enums.GradeSource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The authoritative grade of a submission. One per submission.
 */
@Entity
@Table(name = "grades", uniqueConstraints = {
    @UniqueConstraint(name = "uk_grade_submission", columnNames = "submission_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Grade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false)
    private Long submissionId;

    @Column(name = "final_score", nullable = false)
    private Double finalScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private GradeSource source;

    /**
     * Evaluation the AI score was taken from, if any.
     */
    @Column(name = "evaluation_result_id")
    private Long evaluationResultId;

    /**
     * Instructor who entered the last manual score.
     */
    @Column(name = "instructor_id")
    private Long instructorId;

    @Column(name = "instructor_feedback", length = 2000)
    private String instructorFeedback;

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

    public boolean isManuallySet() {
        return source == GradeSource.MANUAL || source == GradeSource.AI_OVERRIDDEN;
    }
}

package com.lumen.grading.model.domain;

import java.time.LocalDateTime;

import com.lumen.grading.model.enums.SyncState;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery of one grade value to one LMS integration.
 *
 * At most one PENDING job exists per (grade, integration). A re-grade after a
 * job reached a terminal state opens a new job.
 */
@Entity
@Table(name = "sync_jobs", indexes = {
    @Index(name = "idx_sync_grade", columnList = "grade_id"),
    @Index(name = "idx_sync_integration", columnList = "integration_id"),
    @Index(name = "idx_sync_state_next", columnList = "state, next_attempt_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "grade_id", nullable = false)
    private Long gradeId;

    @Column(name = "integration_id", nullable = false)
    private Long integrationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    @Builder.Default
    private SyncState state = SyncState.PENDING;

    /**
     * Score this job delivers.
     */
    @Column(name = "score", nullable = false)
    private Double score;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private int attemptCount = 0;

    /**
     * Short classification of the last error (e.g. "Timeout", "HttpStatus503").
     */
    @Column(name = "last_error_class", length = 50)
    private String lastErrorClass;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "last_attempted_at")
    private LocalDateTime lastAttemptedAt;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public void recordSuccess(LocalDateTime at) {
        this.state = SyncState.SENT;
        this.lastAttemptedAt = at;
        this.nextAttemptAt = null;
        this.lastErrorClass = null;
        this.lastError = null;
    }

    public void recordFailure(String errorClass, String error) {
        this.lastErrorClass = errorClass;
        this.lastError = error != null ? error.substring(0, Math.min(error.length(), 500)) : "Unknown error";
    }
}

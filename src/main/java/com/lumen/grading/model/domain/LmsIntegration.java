package com.lumen.grading.model.domain;

import java.time.LocalDateTime;

import com.lumen.grading.model.enums.LmsType;

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
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LMS connection configured for one course.
 *
 * The API key is stored encrypted (AES-256-GCM). The sync dispatcher only
 * reads this record.
 */
@Entity
@Table(name = "lms_integrations", indexes = {
    @Index(name = "idx_lms_course", columnList = "course_id"),
    @Index(name = "idx_lms_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LmsIntegration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "lms_type", nullable = false, length = 20)
    private LmsType lmsType;

    /**
     * Friendly name for this connection (e.g., "Spring Term Canvas")
     */
    @NotBlank
    @Column(name = "connection_name", nullable = false, unique = true, length = 100)
    private String connectionName;

    /**
     * Internal course whose grades flow to this integration
     */
    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    /**
     * Course identifier on the LMS side
     */
    @NotBlank
    @Column(name = "external_course_id", nullable = false, length = 100)
    private String externalCourseId;

    @Column(name = "api_base_url", length = 255)
    private String apiBaseUrl;

    @Column(name = "encrypted_api_key", length = 1024)
    private String encryptedApiKey;

    @Column(name = "active")
    @Builder.Default
    private Boolean active = true;

    @Column(name = "sync_enabled")
    @Builder.Default
    private Boolean syncEnabled = true;

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

    /**
     * Check if grades may be pushed through this integration.
     */
    public boolean isDeliverable() {
        return Boolean.TRUE.equals(active) && Boolean.TRUE.equals(syncEnabled);
    }

    public String resolveBaseUrl() {
        return apiBaseUrl == null || apiBaseUrl.isBlank() ? lmsType.getDefaultApiUrl() : apiBaseUrl;
    }
}

package com.lumen.grading.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Student identity on the LMS side of an integration.
 */
@Entity
@Table(name = "lms_student_mappings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_mapping_student", columnNames = {"integration_id", "student_id"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LmsStudentMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "integration_id", nullable = false)
    private Long integrationId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    /**
     * e.g. Canvas SIS user id, Moodle user id, Blackboard user id
     */
    @Column(name = "external_student_id", nullable = false, length = 100)
    private String externalStudentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }
}

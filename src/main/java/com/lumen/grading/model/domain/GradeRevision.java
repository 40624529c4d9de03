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
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only history of every value a grade has held.
 */
@Entity
@Table(name = "grade_revisions", indexes = {
    @Index(name = "idx_rev_grade", columnList = "grade_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradeRevision {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "grade_id", nullable = false)
    private Long gradeId;

    @Column(name = "revision_number", nullable = false)
    private int revisionNumber;

    @Column(name = "score", nullable = false)
    private Double score;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private GradeSource source;

    @Column(name = "instructor_id")
    private Long instructorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }
}

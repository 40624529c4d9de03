package com.lumen.grading.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.Grade;

/**
 * Repository for Grade entities.
 */
@Repository
public interface GradeRepository extends JpaRepository<Grade, Long> {

    Optional<Grade> findBySubmissionId(Long submissionId);

    boolean existsBySubmissionId(Long submissionId);
}

package com.lumen.grading.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.GradeRevision;

/**
 * Repository for GradeRevision entities.
 */
@Repository
public interface GradeRevisionRepository extends JpaRepository<GradeRevision, Long> {

    List<GradeRevision> findByGradeIdOrderByRevisionNumberAsc(Long gradeId);

    long countByGradeId(Long gradeId);
}

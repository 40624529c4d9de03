package com.lumen.grading.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.LmsIntegration;

/**
 * Repository for LmsIntegration entities.
 */
@Repository
public interface LmsIntegrationRepository extends JpaRepository<LmsIntegration, Long> {

    /**
     * Integrations grades of a course are pushed to.
     */
    List<LmsIntegration> findByCourseIdAndActiveTrueAndSyncEnabledTrue(Long courseId);

    List<LmsIntegration> findByCourseId(Long courseId);

    boolean existsByConnectionName(String connectionName);
}

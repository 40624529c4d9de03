package com.lumen.grading.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.LmsStudentMapping;

/**
 * Repository for LmsStudentMapping entities.
 */
@Repository
public interface LmsStudentMappingRepository extends JpaRepository<LmsStudentMapping, Long> {

    Optional<LmsStudentMapping> findByIntegrationIdAndStudentId(Long integrationId, Long studentId);

    List<LmsStudentMapping> findByIntegrationId(Long integrationId);
}

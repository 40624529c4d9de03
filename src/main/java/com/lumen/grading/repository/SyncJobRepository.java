package com.lumen.grading.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.model.enums.SyncState;

/**
 * Repository for SyncJob entities.
 */
@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, Long> {

    List<SyncJob> findByGradeIdOrderByCreatedAtAsc(Long gradeId);

    Optional<SyncJob> findFirstByGradeIdAndIntegrationIdAndState(Long gradeId, Long integrationId, SyncState state);

    /**
     * Integrations that already acknowledged a value of this grade.
     */
    @Query("SELECT DISTINCT j.integrationId FROM SyncJob j WHERE j.gradeId = :gradeId AND j.state = :state")
    List<Long> findIntegrationIdsByGradeIdAndState(
            @Param("gradeId") Long gradeId,
            @Param("state") SyncState state);

    /**
     * Pending jobs whose retry time has come.
     */
    @Query("SELECT j.id FROM SyncJob j WHERE j.state = com.lumen.grading.model.enums.SyncState.PENDING " +
           "AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now) ORDER BY j.updatedAt ASC")
    List<Long> findDuePendingIds(@Param("now") LocalDateTime now, Pageable pageable);

    List<SyncJob> findByStateOrderByUpdatedAtDesc(SyncState state);

    long countByState(SyncState state);
}

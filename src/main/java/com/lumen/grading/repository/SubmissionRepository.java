package com.lumen.grading.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.enums.SubmissionState;

/**
 * Repository for Submission entities.
 */
@Repository
public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    /**
     * Find submissions the pipeline can work on now, oldest first.
     */
    @Query("SELECT s.id FROM Submission s WHERE s.state IN :states " +
           "AND (s.nextAttemptAt IS NULL OR s.nextAttemptAt <= :now) ORDER BY s.updatedAt ASC")
    List<Long> findDueIds(
            @Param("states") Collection<SubmissionState> states,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    List<Submission> findByStudentIdOrderByCreatedAtDesc(Long studentId);

    /**
     * Submissions an instructor has to look at (terminal failures).
     */
    List<Submission> findByStateInOrderByUpdatedAtDesc(Collection<SubmissionState> states);

    long countByStateIn(Collection<SubmissionState> states);
}

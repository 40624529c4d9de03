package com.lumen.grading.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.lumen.grading.model.domain.EvaluationResult;
import com.lumen.grading.model.enums.EvaluationOutcome;

/**
 * Repository for EvaluationResult entities.
 */
@Repository
public interface EvaluationResultRepository extends JpaRepository<EvaluationResult, Long> {

    List<EvaluationResult> findBySubmissionIdOrderByAttemptNumberAsc(Long submissionId);

    /**
     * Active evaluation: highest-numbered successful attempt that was not discarded.
     */
    Optional<EvaluationResult> findFirstBySubmissionIdAndOutcomeAndDiscardedFalseOrderByAttemptNumberDesc(
            Long submissionId, EvaluationOutcome outcome);

    Optional<EvaluationResult> findBySubmissionIdAndAttemptNumber(Long submissionId, int attemptNumber);
}

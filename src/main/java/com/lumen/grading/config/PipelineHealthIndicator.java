package com.lumen.grading.config;

import java.util.EnumSet;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.model.enums.SyncState;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.repository.SyncJobRepository;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the grading pipeline.
 *
 * Always UP while the database answers; the details show the backlog and
 * the work waiting for an instructor.
 */
@Component
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    private final SubmissionRepository submissionRepository;
    private final SyncJobRepository syncJobRepository;

    @Override
    public Health health() {
        try {
            long inProgress = submissionRepository.countByStateIn(SubmissionState.IN_PROGRESS);
            long failed = submissionRepository.countByStateIn(
                    EnumSet.of(SubmissionState.EXTRACTION_FAILED, SubmissionState.EVALUATION_FAILED));
            long pendingSync = syncJobRepository.countByState(SyncState.PENDING);
            long failedSync = syncJobRepository.countByState(SyncState.FAILED);

            return Health.up()
                    .withDetail("submissions-in-progress", inProgress)
                    .withDetail("submissions-awaiting-instructor", failed)
                    .withDetail("sync-jobs-pending", pendingSync)
                    .withDetail("sync-jobs-failed", failedSync)
                    .build();

        } catch (Exception e) {
            return Health.down(e).build();
        }
    }
}

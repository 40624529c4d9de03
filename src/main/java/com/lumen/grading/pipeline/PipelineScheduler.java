package com.lumen.grading.pipeline;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.model.enums.SubmissionState;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.repository.SyncJobRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Polls for submissions and sync jobs whose next attempt is due and hands
 * them to the {@link PipelineWorker}.
 *
 * Work survives restarts because everything the poll needs is stored on the
 * entities.
 */
@Component
@ConditionalOnProperty(prefix = "lumen.grading.pipeline", name = "scheduler-enabled",
        havingValue = "true", matchIfMissing = true)
@Slf4j
public class PipelineScheduler {

    private final SubmissionRepository submissionRepository;
    private final SyncJobRepository syncJobRepository;
    private final PipelineWorker worker;
    private final Clock clock;
    private final int batchSize;

    public PipelineScheduler(SubmissionRepository submissionRepository,
                             SyncJobRepository syncJobRepository,
                             PipelineWorker worker,
                             Clock clock,
                             GradingProperties properties) {
        this.submissionRepository = submissionRepository;
        this.syncJobRepository = syncJobRepository;
        this.worker = worker;
        this.clock = clock;
        this.batchSize = Math.max(1, properties.getPipeline().getBatchSize());
    }

    @Scheduled(fixedDelayString = "${lumen.grading.pipeline.poll-interval-ms:5000}")
    public void poll() {
        LocalDateTime now = LocalDateTime.now(clock);

        try {
            List<Long> dueSubmissions = submissionRepository.findDueIds(
                    SubmissionState.IN_PROGRESS, now, PageRequest.of(0, batchSize));
            List<Long> dueSyncJobs = syncJobRepository.findDuePendingIds(now, PageRequest.of(0, batchSize));

            if (!dueSubmissions.isEmpty() || !dueSyncJobs.isEmpty()) {
                log.debug("PIPELINE: Poll found {} submission(s) and {} sync job(s) due",
                        dueSubmissions.size(), dueSyncJobs.size());
            }

            dueSubmissions.forEach(worker::process);
            dueSyncJobs.forEach(worker::deliver);

        } catch (Exception e) {
            log.error("PIPELINE: Scheduler poll failed: {}", e.getMessage(), e);
        }
    }
}

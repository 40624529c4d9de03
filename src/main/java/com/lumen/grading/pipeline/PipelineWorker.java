package com.lumen.grading.pipeline;

import java.util.concurrent.CompletableFuture;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import com.lumen.grading.config.PipelineExecutorConfig;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.service.SyncDispatcher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs pipeline work on the pipeline executor.
 *
 * A submission or sync job already being worked on is skipped rather than
 * queued twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineWorker {

    private final SubmissionPipelineService pipelineService;
    private final SyncDispatcher syncDispatcher;
    private final SubmissionLockRegistry locks;

    @Async(PipelineExecutorConfig.PIPELINE_EXECUTOR)
    public CompletableFuture<Submission> process(Long submissionId) {
        if (!locks.tryMarkSubmissionInFlight(submissionId)) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.completedFuture(pipelineService.drive(submissionId));
        } catch (Exception e) {
            log.error("PIPELINE: Processing of submission {} failed: {}", submissionId, e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        } finally {
            locks.clearSubmissionInFlight(submissionId);
        }
    }

    @Async(PipelineExecutorConfig.PIPELINE_EXECUTOR)
    public CompletableFuture<SyncJob> deliver(Long syncJobId) {
        if (!locks.tryMarkSyncJobInFlight(syncJobId)) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.completedFuture(syncDispatcher.deliver(syncJobId));
        } catch (Exception e) {
            log.error("SYNC: Delivery of job {} failed: {}", syncJobId, e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        } finally {
            locks.clearSyncJobInFlight(syncJobId);
        }
    }
}

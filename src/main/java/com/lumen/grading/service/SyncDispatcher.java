package com.lumen.grading.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.lumen.grading.adapter.LmsConnector;
import com.lumen.grading.adapter.LmsConnector.GradePush;
import com.lumen.grading.adapter.LmsConnector.PushAck;
import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.LmsDeliveryException;
import com.lumen.grading.exception.SyncJobConflictException;
import com.lumen.grading.exception.SyncJobNotFoundException;
import com.lumen.grading.model.domain.Grade;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.domain.LmsStudentMapping;
import com.lumen.grading.model.domain.Submission;
import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.model.enums.SyncState;
import com.lumen.grading.pipeline.RetryPolicy;
import com.lumen.grading.pipeline.SubmissionLockRegistry;
import com.lumen.grading.repository.GradeRepository;
import com.lumen.grading.repository.LmsIntegrationRepository;
import com.lumen.grading.repository.LmsStudentMappingRepository;
import com.lumen.grading.repository.SubmissionRepository;
import com.lumen.grading.repository.SyncJobRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Pushes final grades to the LMS integrations of a course.
 *
 * Each (grade, integration) pair has its own sync job with independent
 * retry state; a failing integration never holds up another one, and no
 * outcome here ever changes the submission or the grade. Integrations are
 * only read.
 */
@Service
@Slf4j
public class SyncDispatcher {

    public static final String UNMAPPED_STUDENT = "UnmappedStudent";
    public static final String UNSUPPORTED_LMS = "UnsupportedLms";
    public static final String INTEGRATION_MISSING = "IntegrationMissing";

    private final SyncJobRepository syncJobRepository;
    private final LmsIntegrationRepository integrationRepository;
    private final LmsStudentMappingRepository mappingRepository;
    private final GradeRepository gradeRepository;
    private final SubmissionRepository submissionRepository;
    private final Map<LmsType, LmsConnector> lmsConnectors;
    private final SubmissionLockRegistry locks;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public SyncDispatcher(SyncJobRepository syncJobRepository,
                          LmsIntegrationRepository integrationRepository,
                          LmsStudentMappingRepository mappingRepository,
                          GradeRepository gradeRepository,
                          SubmissionRepository submissionRepository,
                          Map<LmsType, LmsConnector> lmsConnectors,
                          SubmissionLockRegistry locks,
                          GradingProperties properties,
                          Clock clock) {
        this.syncJobRepository = syncJobRepository;
        this.integrationRepository = integrationRepository;
        this.mappingRepository = mappingRepository;
        this.gradeRepository = gradeRepository;
        this.submissionRepository = submissionRepository;
        this.lmsConnectors = lmsConnectors;
        this.locks = locks;
        this.retryPolicy = RetryPolicy.forSync(properties);
        this.clock = clock;
    }

    /**
     * Create (or reuse) the pending job of every active integration of the
     * course and attempt delivery right away.
     *
     * @return the jobs, in their state after the first attempt
     */
    public List<SyncJob> dispatch(Grade grade, Long courseId) {
        List<SyncJob> jobs = enqueue(grade, courseId);
        return deliverAll(jobs);
    }

    /**
     * Create (or reuse) the pending job of every active, sync-enabled
     * integration of the course. Makes no external call.
     */
    public List<SyncJob> enqueue(Grade grade, Long courseId) {
        List<LmsIntegration> integrations = integrationRepository.findByCourseIdAndActiveTrueAndSyncEnabledTrue(courseId);
        if (integrations.isEmpty()) {
            log.debug("SYNC: No active integration for course {}, grade {} stays local", courseId, grade.getId());
            return List.of();
        }

        List<SyncJob> jobs = new ArrayList<>();
        for (LmsIntegration integration : integrations) {
            jobs.add(enqueueFor(grade, integration.getId()));
        }
        return jobs;
    }

    /**
     * After a grade changed value: send the new value to every integration
     * that acknowledged an older one, and refresh the score of jobs still
     * waiting to be delivered.
     */
    public List<SyncJob> redispatchAfterRegrade(Grade grade) {
        return deliverAll(enqueueRegrade(grade));
    }

    /**
     * The enqueue half of {@link #redispatchAfterRegrade}. Makes no external call.
     */
    public List<SyncJob> enqueueRegrade(Grade grade) {
        Set<Long> integrationIds = new LinkedHashSet<>(
                syncJobRepository.findIntegrationIdsByGradeIdAndState(grade.getId(), SyncState.SENT));
        integrationIds.addAll(syncJobRepository.findIntegrationIdsByGradeIdAndState(grade.getId(), SyncState.PENDING));

        List<SyncJob> jobs = new ArrayList<>();
        for (Long integrationId : integrationIds) {
            jobs.add(enqueueFor(grade, integrationId));
        }

        log.info("SYNC: Grade {} re-dispatched to {} integration(s)", grade.getId(), jobs.size());
        return jobs;
    }

    /**
     * Manually re-trigger a failed or disabled job. The old job is kept as
     * history; a new pending job carries the current grade value.
     */
    public SyncJob retrySyncJob(Long syncJobId) {
        SyncJob failed = syncJobRepository.findById(syncJobId)
                .orElseThrow(() -> new SyncJobNotFoundException(syncJobId));

        if (failed.getState() != SyncState.FAILED && failed.getState() != SyncState.DISABLED) {
            throw new SyncJobConflictException(syncJobId, failed.getState());
        }

        Grade grade = gradeRepository.findById(failed.getGradeId())
                .orElseThrow(() -> new IllegalStateException("Grade " + failed.getGradeId() + " no longer exists"));

        log.info("SYNC: Manual retry of job {} (integration {})", syncJobId, failed.getIntegrationId());
        SyncJob job = locks.withSubmissionLock(grade.getSubmissionId(), () -> {
            Grade current = gradeRepository.findById(grade.getId()).orElse(grade);
            return enqueueFor(current, failed.getIntegrationId());
        });
        return deliver(job.getId());
    }

    public List<SyncJob> deliverAll(List<SyncJob> jobs) {
        List<SyncJob> delivered = new ArrayList<>(jobs.size());
        for (SyncJob job : jobs) {
            delivered.add(deliver(job.getId()));
        }
        return delivered;
    }

    /**
     * Attempt delivery of one pending job whose retry time has come.
     * Anything else is returned unchanged.
     */
    public SyncJob deliver(Long syncJobId) {
        return locks.withSyncJobLock(syncJobId, () -> deliverLocked(syncJobId));
    }

    private SyncJob deliverLocked(Long syncJobId) {
        SyncJob job = syncJobRepository.findById(syncJobId)
                .orElseThrow(() -> new SyncJobNotFoundException(syncJobId));
        LocalDateTime now = LocalDateTime.now(clock);

        if (job.getState() != SyncState.PENDING
                || (job.getNextAttemptAt() != null && job.getNextAttemptAt().isAfter(now))) {
            return job;
        }

        Optional<LmsIntegration> integrationOpt = integrationRepository.findById(job.getIntegrationId());
        if (integrationOpt.isEmpty()) {
            return fail(job, INTEGRATION_MISSING, "Integration " + job.getIntegrationId() + " was removed");
        }
        LmsIntegration integration = integrationOpt.get();

        if (!integration.isDeliverable()) {
            log.info("SYNC: Job {} disabled, integration {} is inactive or has sync off",
                    job.getId(), integration.getConnectionName());
            job.setState(SyncState.DISABLED);
            job.setNextAttemptAt(null);
            return syncJobRepository.save(job);
        }

        LmsConnector connector = lmsConnectors.get(integration.getLmsType());
        if (connector == null) {
            return fail(job, UNSUPPORTED_LMS, "No connector for " + integration.getLmsType());
        }

        Optional<Submission> submission = gradeRepository.findById(job.getGradeId())
                .flatMap(grade -> submissionRepository.findById(grade.getSubmissionId()));
        if (submission.isEmpty()) {
            return fail(job, INTEGRATION_MISSING, "Grade " + job.getGradeId() + " has no submission");
        }

        Optional<LmsStudentMapping> mapping = mappingRepository.findByIntegrationIdAndStudentId(
                integration.getId(), submission.get().getStudentId());
        if (mapping.isEmpty()) {
            return fail(job, UNMAPPED_STUDENT, "Student " + submission.get().getStudentId()
                    + " has no account on " + integration.getConnectionName());
        }

        GradePush push = new GradePush(integration.getExternalCourseId(), mapping.get().getExternalStudentId(),
                submission.get().getAssignmentId(), job.getScore());

        job.setAttemptCount(job.getAttemptCount() + 1);
        job.setLastAttemptedAt(now);

        try {
            PushAck ack = connector.pushGrade(integration, push);
            job.recordSuccess(now);
            log.info("SYNC: Job {} sent score {} to {} ({})", job.getId(), job.getScore(),
                    integration.getConnectionName(), ack != null ? ack.message() : "no acknowledgement");
            return syncJobRepository.save(job);

        } catch (LmsDeliveryException e) {
            return handleDeliveryFailure(job, integration, e.getErrorClass(), e.isTransientFailure(), e.getMessage(), now);
        } catch (Exception e) {
            return handleDeliveryFailure(job, integration, "UnexpectedError", true, e.getMessage(), now);
        }
    }

    private SyncJob handleDeliveryFailure(SyncJob job, LmsIntegration integration, String errorClass,
                                          boolean transientFailure, String message, LocalDateTime now) {
        job.recordFailure(errorClass, message);

        if (transientFailure && retryPolicy.canRetry(job.getAttemptCount())) {
            job.setNextAttemptAt(now.plus(retryPolicy.backoff(job.getAttemptCount())));
            log.warn("SYNC: Job {} to {} failed ({}/{}), retrying at {}: {}", job.getId(),
                    integration.getConnectionName(), job.getAttemptCount(), retryPolicy.maxAttempts(),
                    job.getNextAttemptAt(), message);
            return syncJobRepository.save(job);
        }

        log.error("SYNC: Job {} to {} failed permanently [{}]: {}", job.getId(),
                integration.getConnectionName(), errorClass, message);
        job.setState(SyncState.FAILED);
        job.setNextAttemptAt(null);
        return syncJobRepository.save(job);
    }

    private SyncJob fail(SyncJob job, String errorClass, String message) {
        log.error("SYNC: Job {} failed [{}]: {}", job.getId(), errorClass, message);
        job.recordFailure(errorClass, message);
        job.setState(SyncState.FAILED);
        job.setNextAttemptAt(null);
        return syncJobRepository.save(job);
    }

    /**
     * Reuse the pending job of the pair (refreshing its score) or open a new
     * one. Callers hold the submission lock, so two pending jobs for the same
     * pair cannot be opened concurrently.
     */
    private SyncJob enqueueFor(Grade grade, Long integrationId) {
        Optional<SyncJob> pending = syncJobRepository.findFirstByGradeIdAndIntegrationIdAndState(
                grade.getId(), integrationId, SyncState.PENDING);

        if (pending.isPresent()) {
            SyncJob refreshed = locks.withSyncJobLock(pending.get().getId(), () ->
                    syncJobRepository.findById(pending.get().getId())
                            .filter(job -> job.getState() == SyncState.PENDING)
                            .map(job -> refreshScore(job, grade.getFinalScore()))
                            .orElse(null));
            if (refreshed != null) {
                return refreshed;
            }
        }

        SyncJob job = syncJobRepository.save(SyncJob.builder()
                .gradeId(grade.getId())
                .integrationId(integrationId)
                .score(grade.getFinalScore())
                .build());
        log.debug("SYNC: Opened job {} for grade {} -> integration {}", job.getId(), grade.getId(), integrationId);
        return job;
    }

    private SyncJob refreshScore(SyncJob job, Double score) {
        if (score.equals(job.getScore())) {
            return job;
        }
        job.setScore(score);
        return syncJobRepository.save(job);
    }
}

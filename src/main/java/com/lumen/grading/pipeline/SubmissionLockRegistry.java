package com.lumen.grading.pipeline;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * In-process mutual exclusion for pipeline work.
 *
 * Every state change of a submission (pipeline steps, overrides,
 * cancellation) runs under that submission's lock; every delivery of a sync
 * job runs under the job's lock. Long external calls are made outside the
 * locks. The in-flight set stops the scheduler from queueing the same
 * submission twice.
 */
@Component
public class SubmissionLockRegistry {

    private final Map<Long, ReentrantLock> submissionLocks = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> syncJobLocks = new ConcurrentHashMap<>();
    private final Set<Long> inFlightSubmissions = ConcurrentHashMap.newKeySet();
    private final Set<Long> inFlightSyncJobs = ConcurrentHashMap.newKeySet();

    public <T> T withSubmissionLock(Long submissionId, Supplier<T> action) {
        return withLock(submissionLocks.computeIfAbsent(submissionId, id -> new ReentrantLock()), action);
    }

    public <T> T withSyncJobLock(Long syncJobId, Supplier<T> action) {
        return withLock(syncJobLocks.computeIfAbsent(syncJobId, id -> new ReentrantLock()), action);
    }

    public boolean tryMarkSubmissionInFlight(Long submissionId) {
        return inFlightSubmissions.add(submissionId);
    }

    public void clearSubmissionInFlight(Long submissionId) {
        inFlightSubmissions.remove(submissionId);
    }

    public boolean tryMarkSyncJobInFlight(Long syncJobId) {
        return inFlightSyncJobs.add(syncJobId);
    }

    public void clearSyncJobInFlight(Long syncJobId) {
        inFlightSyncJobs.remove(syncJobId);
    }

    private static <T> T withLock(ReentrantLock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

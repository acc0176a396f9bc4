package com.example.jobscheduler.service.store;

import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.exception.InvalidJobStateException;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.exception.JobPersistenceException;
import com.example.jobscheduler.persistence.JobPersistence;
import com.example.jobscheduler.service.queue.TimeOrderedQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative in-memory registry of jobs.
 * <p>
 * Every status transition happens here under a single write lock, together with the
 * matching change to the {@link TimeOrderedQueue}, so a job is pending in the queue
 * exactly when its status is SCHEDULED.
 * <p>
 * Durable writes happen outside the store lock. The write-order lock is taken before the
 * store lock is released, so rows reach the database in the same order the in-memory
 * changes were made. A write that fails leaves the in-memory change in place and the job
 * id in the pending-write set until {@link #flushPendingWrites()} succeeds.
 * <p>
 * The RUNNING status is never written on its own; a claim only becomes durable together
 * with its outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobStore {

    private static final Comparator<ScheduledJob> BY_RUN_TIME =
            Comparator.comparing(ScheduledJob::getRunAt).thenComparing(ScheduledJob::getCreatedAt);

    private final TimeOrderedQueue queue;
    private final JobPersistence persistence;
    private final Clock clock;

    private final Map<UUID, ScheduledJob> jobs = new HashMap<>();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final ReentrantLock writeOrderLock = new ReentrantLock(true);
    private final Set<UUID> pendingWrites = ConcurrentHashMap.newKeySet();

    // === Creation and lookup ===

    /**
     * Register a new SCHEDULED job.
     * <p>
     * The job is written to the database before it becomes visible, so a failed
     * write leaves no trace.
     *
     * @throws JobPersistenceException if the initial write fails
     */
    public ScheduledJob create(Instant runAt, String payload, boolean recurring, Duration interval) {
        var now = clock.instant();
        var job = ScheduledJob.builder()
                .id(UUID.randomUUID())
                .runAt(runAt)
                .payload(payload)
                .status(JobStatus.SCHEDULED)
                .retries(0)
                .recurring(recurring)
                .interval(interval != null ? interval : Duration.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();

        save(job);

        var write = stateLock.writeLock();
        write.lock();
        try {
            jobs.put(job.getId(), job);
            queue.insert(job.getId(), job.getRunAt());
        } finally {
            write.unlock();
        }

        log.info("Created job {} (runAt: {}, recurring: {}, interval: {})",
                job.getId(), job.getRunAt(), recurring, job.getInterval());
        return job.copy();
    }

    public Optional<ScheduledJob> get(UUID jobId) {
        var read = stateLock.readLock();
        read.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId)).map(ScheduledJob::copy);
        } finally {
            read.unlock();
        }
    }

    /**
     * Snapshot of every known job, ordered by run time
     */
    public List<ScheduledJob> list() {
        return list(null);
    }

    /**
     * Snapshot of the jobs in the given status, ordered by run time.
     * A null status matches every job.
     */
    public List<ScheduledJob> list(JobStatus status) {
        var read = stateLock.readLock();
        read.lock();
        try {
            return jobs.values().stream()
                    .filter(job -> status == null || job.getStatus() == status)
                    .map(ScheduledJob::copy)
                    .sorted(BY_RUN_TIME)
                    .toList();
        } finally {
            read.unlock();
        }
    }

    public Map<JobStatus, Long> countByStatus() {
        var counts = new EnumMap<JobStatus, Long>(JobStatus.class);
        for (var status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        var read = stateLock.readLock();
        read.lock();
        try {
            for (var job : jobs.values()) {
                counts.merge(job.getStatus(), 1L, Long::sum);
            }
        } finally {
            read.unlock();
        }
        return counts;
    }

    public long count(JobStatus status) {
        return countByStatus().get(status);
    }

    public int queueDepth() {
        return queue.size();
    }

    public int pendingWriteCount() {
        return pendingWrites.size();
    }

    // === Transitions ===

    /**
     * Cancel a SCHEDULED job. Cancelling a job that is already cancelled, done or dead
     * changes nothing.
     *
     * @throws JobPersistenceException if the job was cancelled in memory but the write failed
     */
    public CancelOutcome cancel(UUID jobId) {
        ScheduledJob snapshot;
        var write = stateLock.writeLock();
        write.lock();
        try {
            var job = jobs.get(jobId);
            if (job == null) {
                return CancelOutcome.NOT_FOUND;
            }
            if (job.getStatus() == JobStatus.RUNNING) {
                return CancelOutcome.ALREADY_RUNNING;
            }
            if (job.getStatus().isTerminal()) {
                return CancelOutcome.ALREADY_TERMINAL;
            }
            queue.remove(jobId);
            job.setStatus(JobStatus.CANCELLED);
            snapshot = commit(job);
        } finally {
            write.unlock();
        }

        writeThrough(snapshot);
        log.info("Cancelled job {}", jobId);
        return CancelOutcome.CANCELLED;
    }

    /**
     * Pop the earliest due job off the queue and mark it RUNNING.
     * <p>
     * Queue entries whose job is no longer SCHEDULED are discarded along the way.
     *
     * @return the claimed job, or empty if nothing is due at {@code now}
     */
    public Optional<ScheduledJob> claimDue(Instant now) {
        var write = stateLock.writeLock();
        write.lock();
        try {
            while (true) {
                var next = queue.popDue(now);
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                var job = jobs.get(next.get());
                if (job == null || !job.isDue(now)) {
                    log.debug("Discarding stale queue entry for job {}", next.get());
                    continue;
                }
                job.setStatus(JobStatus.RUNNING);
                job.setUpdatedAt(now);
                log.debug("Claimed job {} (runAt: {})", job.getId(), job.getRunAt());
                return Optional.of(job.copy());
            }
        } finally {
            write.unlock();
        }
    }

    /**
     * Hand a claimed job back to the queue without counting an attempt.
     * Used when no worker could accept it.
     */
    public void releaseClaim(UUID jobId) {
        var write = stateLock.writeLock();
        write.lock();
        try {
            var job = requireRunning(jobId, JobStatus.SCHEDULED);
            job.setStatus(JobStatus.SCHEDULED);
            job.setUpdatedAt(clock.instant());
            queue.insert(jobId, job.getRunAt());
            log.debug("Released claim on job {}", jobId);
        } finally {
            write.unlock();
        }
    }

    /**
     * Record a successful run of a RUNNING job.
     *
     * @param nextRunAt next run of a recurring job, or null to mark the job DONE
     * @return the job as stored after the transition
     * @throws JobPersistenceException if the transition was applied but the write failed
     */
    public ScheduledJob markSucceeded(UUID jobId, Instant completedAt, Instant nextRunAt) {
        ScheduledJob snapshot;
        var write = stateLock.writeLock();
        write.lock();
        try {
            var job = requireRunning(jobId, nextRunAt != null ? JobStatus.SCHEDULED : JobStatus.DONE);
            job.setCompletedAt(completedAt);
            job.setLastError(null);
            if (nextRunAt != null) {
                job.setStatus(JobStatus.SCHEDULED);
                job.setRunAt(nextRunAt);
                queue.insert(jobId, nextRunAt);
            } else {
                job.setStatus(JobStatus.DONE);
            }
            snapshot = commit(job);
        } finally {
            write.unlock();
        }

        writeThrough(snapshot);
        return snapshot;
    }

    /**
     * Record a failed attempt of a RUNNING job.
     *
     * @param retries   failed attempts including this one
     * @param error     failure description kept as the job's last error
     * @param nextRunAt retry time, or null to dead-letter the job
     * @return the job as stored after the transition
     * @throws JobPersistenceException if the transition was applied but the write failed
     */
    public ScheduledJob markFailed(UUID jobId, int retries, String error, Instant nextRunAt) {
        ScheduledJob snapshot;
        var write = stateLock.writeLock();
        write.lock();
        try {
            var job = requireRunning(jobId, nextRunAt != null ? JobStatus.SCHEDULED : JobStatus.DEAD);
            job.setRetries(retries);
            job.setLastError(error);
            if (nextRunAt != null) {
                job.setStatus(JobStatus.SCHEDULED);
                job.setRunAt(nextRunAt);
                queue.insert(jobId, nextRunAt);
            } else {
                job.setStatus(JobStatus.DEAD);
            }
            snapshot = commit(job);
        } finally {
            write.unlock();
        }

        writeThrough(snapshot);
        return snapshot;
    }

    // === Recovery ===

    /**
     * Rebuild the store from persisted jobs. Jobs that were RUNNING when the previous
     * process stopped are scheduled again at their original run time.
     *
     * @return number of jobs queued for dispatch
     */
    public int recover(List<ScheduledJob> persisted) {
        var queued = 0;
        var write = stateLock.writeLock();
        write.lock();
        try {
            for (var stored : persisted) {
                if (stored.getStatus() == JobStatus.DONE) {
                    continue;
                }
                var job = stored.copy();
                if (job.getStatus() == JobStatus.RUNNING) {
                    log.warn("Job {} was running when the scheduler stopped, scheduling it again", job.getId());
                    job.setStatus(JobStatus.SCHEDULED);
                }
                jobs.put(job.getId(), job);
                if (job.getStatus() == JobStatus.SCHEDULED) {
                    queue.insert(job.getId(), job.getRunAt());
                    queued++;
                }
            }
        } finally {
            write.unlock();
        }

        log.info("Recovered {} jobs, {} queued for dispatch", persisted.size(), queued);
        return queued;
    }

    /**
     * Retry durable writes that failed earlier, using each job's current in-memory state
     */
    @Scheduled(fixedDelayString = "${job-scheduler.pending-write-flush-interval-ms:5000}")
    public void flushPendingWrites() {
        if (pendingWrites.isEmpty()) {
            return;
        }

        var flushed = 0;
        for (var jobId : List.copyOf(pendingWrites)) {
            ScheduledJob snapshot;
            var read = stateLock.readLock();
            read.lock();
            try {
                var job = jobs.get(jobId);
                if (job == null) {
                    pendingWrites.remove(jobId);
                    continue;
                }
                snapshot = job.copy();
                writeOrderLock.lock();
            } finally {
                read.unlock();
            }

            try {
                persistence.saveJob(snapshot);
                pendingWrites.remove(jobId);
                flushed++;
            } catch (RuntimeException e) {
                log.warn("Job {} is still not durable: {}", jobId, e.getMessage());
            } finally {
                writeOrderLock.unlock();
            }
        }

        log.info("Flushed {} pending job writes, {} remaining", flushed, pendingWrites.size());
    }

    // === Internals ===

    private ScheduledJob requireRunning(UUID jobId, JobStatus requested) {
        var job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        if (job.getStatus() != JobStatus.RUNNING) {
            throw new InvalidJobStateException(jobId, job.getStatus(), requested, "job is not running");
        }
        return job;
    }

    /**
     * Stamp the change and take the write-order lock. Must be called holding the store write lock;
     * the returned snapshot must be passed to {@link #writeThrough(ScheduledJob)}.
     */
    private ScheduledJob commit(ScheduledJob job) {
        job.setUpdatedAt(clock.instant());
        var snapshot = job.copy();
        writeOrderLock.lock();
        return snapshot;
    }

    private void writeThrough(ScheduledJob snapshot) {
        try {
            persistence.saveJob(snapshot);
            pendingWrites.remove(snapshot.getId());
        } catch (RuntimeException e) {
            pendingWrites.add(snapshot.getId());
            log.error("Job {} changed to {} but the write failed, will retry: {}",
                    snapshot.getId(), snapshot.getStatus(), e.getMessage());
            throw wrap(snapshot.getId(), e);
        } finally {
            writeOrderLock.unlock();
        }
    }

    private void save(ScheduledJob job) {
        try {
            persistence.saveJob(job.copy());
        } catch (RuntimeException e) {
            log.error("Failed to persist new job {}: {}", job.getId(), e.getMessage());
            throw wrap(job.getId(), e);
        }
    }

    private static JobPersistenceException wrap(UUID jobId, RuntimeException e) {
        return e instanceof JobPersistenceException jpe ? jpe : new JobPersistenceException(jobId, e);
    }
}

package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.exception.JobPersistenceException;
import com.example.jobscheduler.service.event.JobDeadLetteredEvent;
import com.example.jobscheduler.service.handler.JobExecutionResult;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs claimed jobs on the worker pool and applies their outcome.
 * <p>
 * Handles:
 * - Worker capacity (one slot per running or queued execution)
 * - Handler invocation under a timeout
 * - Recurrence, retry scheduling and dead-lettering
 * - Metrics recording
 * <p>
 * All state changes go through the {@link JobStore}.
 */
@Slf4j
@Service
public class JobExecutor {

    private final JobStore jobStore;
    private final JobHandler jobHandler;
    private final RetryPolicy retryPolicy;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskExecutor workerExecutor;
    private final TaskScheduler timeoutScheduler;
    private final Clock clock;

    private final int capacity;
    private final Semaphore slots;

    public JobExecutor(JobStore jobStore, JobHandler jobHandler, RetryPolicy retryPolicy, MetricsConfig metricsConfig,
                       JobSchedulerProperties properties, ApplicationEventPublisher eventPublisher,
                       @Qualifier("jobWorkerExecutor") TaskExecutor workerExecutor,
                       @Qualifier("jobTimeoutScheduler") TaskScheduler timeoutScheduler, Clock clock) {
        this.jobStore = jobStore;
        this.jobHandler = jobHandler;
        this.retryPolicy = retryPolicy;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.workerExecutor = workerExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.clock = clock;
        this.capacity = properties.getWorkerPoolSize() + properties.getWorkerQueueCapacity();
        this.slots = new Semaphore(capacity);
    }

    // === Capacity ===

    /**
     * Reserve capacity for one execution. A reserved slot is handed back by
     * {@link #submit(ScheduledJob)} or, if nothing was claimed, by {@link #release()}.
     */
    public boolean tryReserve() {
        return slots.tryAcquire();
    }

    public void release() {
        slots.release();
    }

    /**
     * Wait until at least one slot is free, at most {@code maxWait}
     */
    public boolean awaitCapacity(Duration maxWait) throws InterruptedException {
        if (slots.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
            slots.release();
            return true;
        }
        return false;
    }

    /**
     * Wait until no execution is running or queued, at most {@code maxWait}
     */
    public boolean awaitIdle(Duration maxWait) throws InterruptedException {
        if (slots.tryAcquire(capacity, maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
            slots.release(capacity);
            return true;
        }
        return false;
    }

    public int inFlight() {
        return capacity - slots.availablePermits();
    }

    // === Execution ===

    /**
     * Hand a claimed job to the worker pool. The caller must hold a reserved slot,
     * which is released when the execution ends.
     *
     * @return false if the pool refused the job; the claim is then released back to the queue
     */
    public boolean submit(ScheduledJob job) {
        try {
            workerExecutor.execute(() -> {
                try {
                    run(job);
                } finally {
                    slots.release();
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            slots.release();
            log.warn("Worker pool rejected job {}, returning it to the queue: {}", job.getId(), e.getMessage());
            jobStore.releaseClaim(job.getId());
            return false;
        }
    }

    /**
     * Execute one attempt of a RUNNING job and record its outcome.
     */
    public void run(ScheduledJob job) {
        var jobId = job.getId();
        var attempt = job.getRetries() + 1;
        log.info("Starting execution of job {} (attempt {})", jobId, attempt);

        var timerSample = metricsConfig.startExecutionTimer();
        var result = invokeWithTimeout(job);
        metricsConfig.recordExecution(timerSample, result.isSuccess());

        try {
            if (result.isSuccess()) {
                handleSuccess(job);
            } else {
                handleFailure(job, result);
            }
        } catch (JobPersistenceException e) {
            metricsConfig.recordPersistenceFailure("execution");
            log.error("Outcome of job {} is applied but not yet durable: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error recording outcome of job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private JobExecutionResult invokeWithTimeout(ScheduledJob job) {
        var timeoutMs = properties.getExecutionTimeoutMs();
        var watchdog = new Watchdog(Thread.currentThread());
        var deadline = timeoutScheduler.getClock().instant().plusMillis(timeoutMs);
        var watchdogFuture = timeoutScheduler.schedule(watchdog, deadline);
        var startNanos = System.nanoTime();

        JobExecutionResult result;
        try {
            result = jobHandler.execute(job.getPayload());
            if (result == null) {
                result = JobExecutionResult.failure("Handler returned no result", "NO_RESULT");
            }
        } catch (Exception e) {
            log.warn("Handler threw for job {}: {}", job.getId(), e.toString());
            result = JobExecutionResult.failure(e);
        } finally {
            watchdogFuture.cancel(false);
            watchdog.disarm();
            // A watchdog that fired late must not leak its interrupt into the next job on this thread
            Thread.interrupted();
        }

        var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (watchdog.hasFired() || elapsedMs >= timeoutMs) {
            log.warn("Job {} timed out after {}ms (limit {}ms)", job.getId(), elapsedMs, timeoutMs);
            metricsConfig.recordTimeout();
            return JobExecutionResult.timeout(timeoutMs);
        }
        return result;
    }

    private void handleSuccess(ScheduledJob job) {
        var now = clock.instant();

        if (job.isRecurring()) {
            var nextRunAt = now.plus(job.getInterval());
            jobStore.markSucceeded(job.getId(), now, nextRunAt);
            metricsConfig.recordSuccess(true);
            log.info("Recurring job {} completed, next run at {}", job.getId(), nextRunAt);
        } else {
            jobStore.markSucceeded(job.getId(), now, null);
            metricsConfig.recordSuccess(false);
            log.info("Job {} completed successfully", job.getId());
        }
    }

    private void handleFailure(ScheduledJob job, JobExecutionResult result) {
        var now = clock.instant();
        var retries = job.getRetries() + 1;
        metricsConfig.recordFailure(result.getErrorType());

        if (retries <= properties.getMaxRetries()) {
            var nextRunAt = now.plus(retryPolicy.nextDelay(retries));
            log.warn("Job {} failed: {}. Scheduling retry {} of {} at {}",
                    job.getId(), result.getErrorMessage(), retries, properties.getMaxRetries(), nextRunAt);
            metricsConfig.recordRetry(retries);
            jobStore.markFailed(job.getId(), retries, result.getErrorMessage(), nextRunAt);
            return;
        }

        log.error("Job {} failed after {} attempts, moving to dead letter: {}", job.getId(), retries, result.getErrorMessage());
        metricsConfig.recordDeadLetter();
        try {
            var dead = jobStore.markFailed(job.getId(), retries, result.getErrorMessage(), null);
            eventPublisher.publishEvent(new JobDeadLetteredEvent(dead, retries));
        } catch (JobPersistenceException e) {
            jobStore.get(job.getId()).ifPresent(dead -> eventPublisher.publishEvent(new JobDeadLetteredEvent(dead, retries)));
            throw e;
        }
    }

    /**
     * Interrupts the worker thread once, unless disarmed first.
     */
    private static final class Watchdog implements Runnable {

        private final Thread worker;
        private boolean armed = true;
        private boolean fired = false;

        private Watchdog(Thread worker) {
            this.worker = worker;
        }

        @Override
        public synchronized void run() {
            if (armed) {
                fired = true;
                worker.interrupt();
            }
        }

        synchronized void disarm() {
            armed = false;
        }

        synchronized boolean hasFired() {
            return fired;
        }
    }
}

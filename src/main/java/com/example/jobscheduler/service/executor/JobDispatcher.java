package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.persistence.JobPersistence;
import com.example.jobscheduler.service.queue.TimeOrderedQueue;
import com.example.jobscheduler.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Single control thread that moves due jobs from the queue to the worker pool.
 * <p>
 * Flow:
 * 1. On startup, rebuild the job store from the database
 * 2. Reserve a worker slot, claim the earliest due job, submit it; repeat until nothing
 *    is due or the pool is saturated
 * 3. Idle until the next job is due, a job is inserted, or the poll interval elapses
 * <p>
 * The dispatcher never waits for a handler to finish. On shutdown it stops claiming
 * and waits up to the grace period for in-flight executions.
 * <p>
 * Starts before the embedded web server, so the API never answers from a store that
 * has not been recovered yet, and stops after it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher implements SmartLifecycle {

    private static final String THREAD_NAME = "job-dispatcher";

    /**
     * Below the web server's start/stop phase ({@code SMART_LIFECYCLE_PHASE - 1024})
     */
    static final int PHASE = WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 2048;

    private final JobStore jobStore;
    private final TimeOrderedQueue queue;
    private final JobExecutor jobExecutor;
    private final JobPersistence persistence;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    private volatile boolean running = false;
    private Thread dispatcherThread;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }

        var recovered = persistence.loadActiveJobs();
        jobStore.recover(recovered);

        running = true;
        dispatcherThread = new Thread(this::dispatchLoop, THREAD_NAME);
        dispatcherThread.start();
        log.info("Job dispatcher started (poll interval: {}ms, workers: {})",
                properties.getPollIntervalMs(), properties.getWorkerPoolSize());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping job dispatcher");
        running = false;
        queue.wakeUp();
        try {
            dispatcherThread.join(Duration.ofSeconds(5).toMillis());
            if (dispatcherThread.isAlive()) {
                dispatcherThread.interrupt();
            }

            var grace = Duration.ofSeconds(properties.getShutdownGracePeriodSeconds());
            if (!jobExecutor.awaitIdle(grace)) {
                log.warn("{} job executions still running after the {}s grace period",
                        jobExecutor.inFlight(), grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight jobs");
        }
        log.info("Job dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /**
     * Claim and submit every job that is due now, as far as worker capacity allows.
     *
     * @return number of jobs handed to the worker pool
     */
    public int dispatchDue() {
        var dispatched = 0;
        while (true) {
            if (!jobExecutor.tryReserve()) {
                log.debug("Worker pool saturated, leaving due jobs queued");
                break;
            }

            var claimed = jobStore.claimDue(clock.instant());
            if (claimed.isEmpty()) {
                jobExecutor.release();
                break;
            }

            var job = claimed.get();
            log.info("Dispatching job {} (runAt: {}, attempt {})", job.getId(), job.getRunAt(), job.getRetries() + 1);
            metricsConfig.recordDispatch();
            if (!jobExecutor.submit(job)) {
                break;
            }
            dispatched++;
        }
        return dispatched;
    }

    private void dispatchLoop() {
        var pollInterval = Duration.ofMillis(properties.getPollIntervalMs());

        while (running) {
            try {
                if (dispatchDue() > 0) {
                    continue;
                }
                if (jobExecutor.awaitCapacity(Duration.ZERO)) {
                    queue.awaitDue(clock.instant(), pollInterval);
                } else {
                    jobExecutor.awaitCapacity(pollInterval);
                }
            } catch (InterruptedException e) {
                if (running) {
                    log.warn("Job dispatcher interrupted, continuing");
                }
            } catch (Exception e) {
                log.error("Error in dispatch cycle: {}", e.getMessage(), e);
                pause(pollInterval);
            }
        }
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

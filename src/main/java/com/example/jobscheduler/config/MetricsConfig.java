package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.service.store.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring job scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status
 * - Queue depth and writes awaiting persistence
 * - Execution times
 * - Failure, retry, timeout and dead-letter rates
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobStore jobStore;

    private final Map<JobStatus, AtomicLong> statusCounts = new EnumMap<>(JobStatus.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            var holder = new AtomicLong(0);
            statusCounts.put(status, holder);

            Gauge.builder("job_scheduler_jobs", holder, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of jobs by status")
                    .register(meterRegistry);
        }

        Gauge.builder("job_scheduler_queue_depth", jobStore, JobStore::queueDepth)
                .description("Number of jobs waiting in the time-ordered queue")
                .register(meterRegistry);

        Gauge.builder("job_scheduler_pending_writes", jobStore, JobStore::pendingWriteCount)
                .description("Jobs whose latest change has not reached the database yet")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh the status gauges from the job store
     */
    @Scheduled(fixedDelayString = "${job-scheduler.metrics-update-interval-ms:15000}")
    public void updateMetrics() {
        jobStore.countByStatus().forEach((status, count) -> statusCounts.get(status).set(count));
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time
     */
    public void recordExecution(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("job_scheduler_execution_time")
                .tag("success", String.valueOf(success))
                .description("Job execution time")
                .register(meterRegistry));
    }

    public void recordDispatch() {
        meterRegistry.counter("job_scheduler_dispatched").increment();
    }

    public void recordSuccess(boolean recurring) {
        meterRegistry.counter("job_scheduler_succeeded", "recurring", String.valueOf(recurring)).increment();
    }

    public void recordFailure(String errorType) {
        meterRegistry.counter("job_scheduler_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry(int attemptNumber) {
        meterRegistry.counter("job_scheduler_retries",
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordTimeout() {
        meterRegistry.counter("job_scheduler_timeouts").increment();
    }

    public void recordDeadLetter() {
        meterRegistry.counter("job_scheduler_dead_lettered").increment();
    }

    public void recordPersistenceFailure(String operation) {
        meterRegistry.counter("job_scheduler_persistence_failures", "operation", operation).increment();
    }
}

package com.example.jobscheduler.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Upper bound in milliseconds on how long the dispatcher idles between checks
     */
    @Min(10)
    private long pollIntervalMs = 200;

    /**
     * Number of worker threads executing jobs concurrently
     */
    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Claimed jobs allowed to wait for a free worker
     */
    @Min(0)
    private int workerQueueCapacity = 100;

    /**
     * A job handler running longer than this is interrupted and the attempt counts as failed
     */
    @Min(1)
    private long executionTimeoutMs = 30000;

    /**
     * How long shutdown waits for in-flight executions
     */
    @Min(0)
    private int shutdownGracePeriodSeconds = 30;

    /**
     * Failed attempts tolerated before a job is dead-lettered
     */
    @Min(0)
    private int maxRetries = 3;

    @NotNull
    private RetryStrategy retryStrategy = RetryStrategy.FIXED;

    /**
     * Fixed retry delay, or the first delay for exponential backoff
     */
    @Min(1)
    private long retryDelayMs = 2000;

    @DecimalMin("1.0")
    private double retryMultiplier = 2.0;

    /**
     * Cap on exponential backoff delays
     */
    @Min(1)
    private long maxRetryDelayMs = 300000;

    /**
     * Add +/-10% random variation to exponential backoff delays
     */
    private boolean retryJitter = false;

    /**
     * Largest accepted payload, in UTF-8 bytes
     */
    @Min(0)
    private int maxPayloadBytes = 65536;

    /**
     * Largest accepted delay or recurrence interval, in seconds (default: 10 years)
     */
    @Min(1)
    private long maxDelaySeconds = 315_360_000L;

    /**
     * How often writes that failed to reach the database are retried
     */
    @Min(100)
    private long pendingWriteFlushIntervalMs = 5000;

    @Min(1000)
    private long metricsUpdateIntervalMs = 15000;

    /**
     * Simulated work duration of the default logging handler
     */
    @Min(0)
    private long simulatedWorkMs = 500;

    public enum RetryStrategy {
        FIXED,
        EXPONENTIAL
    }
}

package com.example.jobscheduler.config;

import com.example.jobscheduler.service.executor.ExponentialBackoffRetryPolicy;
import com.example.jobscheduler.service.executor.FixedDelayRetryPolicy;
import com.example.jobscheduler.service.executor.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

/**
 * Thread pools and retry policy of the scheduler.
 * <p>
 * - jobWorkerExecutor: bounded pool running job handlers
 * - jobTimeoutScheduler: watchdog interrupting handlers that overrun their timeout
 * - taskScheduler: housekeeping ({@code @Scheduled} methods)
 * - taskExecutor: Spring's {@code @Async} methods (alerting)
 */
@Slf4j
@EnableAsync
@EnableScheduling
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final JobSchedulerProperties properties;

    /**
     * Fixed-size worker pool with a bounded backlog. Submissions beyond the backlog are rejected;
     * the dispatcher reserves capacity before claiming so this only happens after shutdown.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor() {
        log.info("Creating job worker pool with {} threads and a backlog of {}",
                properties.getWorkerPoolSize(), properties.getWorkerQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(properties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownGracePeriodSeconds());
        return executor;
    }

    @Bean(name = "jobTimeoutScheduler")
    public ThreadPoolTaskScheduler jobTimeoutScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("job-timeout-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("job-housekeeping-");
        return scheduler;
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    @Bean
    public RetryPolicy retryPolicy() {
        var policy = switch (properties.getRetryStrategy()) {
            case FIXED -> new FixedDelayRetryPolicy(Duration.ofMillis(properties.getRetryDelayMs()));
            case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(
                    Duration.ofMillis(properties.getRetryDelayMs()),
                    properties.getRetryMultiplier(),
                    Duration.ofMillis(properties.getMaxRetryDelayMs()),
                    properties.isRetryJitter());
        };
        log.info("Using {} with max {} retries", policy, properties.getMaxRetries());
        return policy;
    }
}

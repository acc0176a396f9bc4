package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Job Scheduler Service Application
 * <p>
 * A single-node scheduler for delayed and recurring jobs.
 * <p>
 * Features:
 * - Time-ordered dispatch with wake-on-insert
 * - Bounded worker pool with per-job timeout
 * - Configurable retry backoff and dead-lettering
 * - Write-through persistence with recovery on restart
 * - Slack alerting for dead-lettered jobs
 */
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}

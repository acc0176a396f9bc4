package com.example.jobscheduler.service.executor;

import java.time.Duration;

/**
 * Same delay before every retry
 */
public class FixedDelayRetryPolicy implements RetryPolicy {

    private final Duration delay;

    public FixedDelayRetryPolicy(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Retry delay must not be negative: " + delay);
        }
        this.delay = delay;
    }

    @Override
    public Duration nextDelay(int failedAttempts) {
        return delay;
    }

    @Override
    public String toString() {
        return "FixedDelayRetryPolicy{delay=" + delay + "}";
    }
}

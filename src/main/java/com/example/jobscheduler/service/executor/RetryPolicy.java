package com.example.jobscheduler.service.executor;

import java.time.Duration;

/**
 * Decides how long a failed job waits before its next attempt
 */
public interface RetryPolicy {

    /**
     * @param failedAttempts failed attempts so far, including the one just finished (at least 1)
     * @return delay before the next attempt
     */
    Duration nextDelay(int failedAttempts);
}

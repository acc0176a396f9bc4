package com.example.jobscheduler.service.executor;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay grows geometrically with each failed attempt.
 * <p>
 * delay(n) = initialDelay * multiplier^(n-1), capped at maxDelay. With jitter enabled the
 * result is spread by up to 10% either way so that jobs failing together do not retry together.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private static final double JITTER_FACTOR = 0.1;

    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final boolean jitter;

    public ExponentialBackoffRetryPolicy(Duration initialDelay, double multiplier, Duration maxDelay, boolean jitter) {
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0: " + multiplier);
        }
        this.initialDelayMs = initialDelay.toMillis();
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelay.toMillis();
        this.jitter = jitter;
    }

    @Override
    public Duration nextDelay(int failedAttempts) {
        var exponent = Math.max(0, failedAttempts - 1);
        var delay = Math.min(initialDelayMs * Math.pow(multiplier, exponent), (double) maxDelayMs);

        if (jitter) {
            var spread = delay * JITTER_FACTOR;
            delay += ThreadLocalRandom.current().nextDouble(-spread, spread);
        }

        return Duration.ofMillis(Math.max(0L, Math.round(delay)));
    }

    @Override
    public String toString() {
        return String.format("ExponentialBackoffRetryPolicy{initialDelayMs=%d, multiplier=%.2f, maxDelayMs=%d, jitter=%s}",
                initialDelayMs, multiplier, maxDelayMs, jitter);
    }
}

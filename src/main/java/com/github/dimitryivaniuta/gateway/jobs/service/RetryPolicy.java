package com.github.dimitryivaniuta.gateway.jobs.service;

import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Retry schedule for retryable failures.
 *
 * <p>Exponential backoff {@code base * 2^(k-1)} capped at {@code max}, where {@code k} is the number of
 * attempts made so far. No jitter, so retry times are reproducible. A job is dead-lettered once
 * {@code k >= maxAttempts}; {@code maxAttempts} counts the first attempt too.</p>
 */
@Component
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;

    @Autowired
    public RetryPolicy(AppProperties properties) {
        this(properties.getJobs().getMaxJobRetries(),
                properties.getJobs().getBaseBackoff(),
                properties.getJobs().getMaxBackoff());
    }

    public RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoff.isNegative() || baseBackoff.isZero() || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException("Require 0 < baseBackoff <= maxBackoff");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Delay before the next attempt.
     *
     * @param attemptCount attempts made so far (values below 1 are treated as 1)
     * @return delay, never above the cap
     */
    public Duration nextDelay(int attemptCount) {
        int shift = Math.max(attemptCount, 1) - 1;
        long baseMs = baseBackoff.toMillis();
        long capMs = maxBackoff.toMillis();
        // base << shift would overflow or exceed the cap
        if (shift >= Long.SIZE - 2 || baseMs > (capMs >> shift)) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.min(baseMs << shift, capMs));
    }

    public boolean shouldDeadLetter(int attemptCount) {
        return attemptCount >= maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}

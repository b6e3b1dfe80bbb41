package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import io.github.resilience4j.core.IntervalFunction;

/**
 * Attempt ceiling plus exponential backoff with jitter, capped at a maximum delay.
 */
public record RetryPolicy(int maxAttempts, IntervalFunction backoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
    }

    public static RetryPolicy from(DebtCheckerProperties.Retry retry) {
        return new RetryPolicy(
                retry.getMaxAttempts(),
                IntervalFunction.ofExponentialRandomBackoff(
                        retry.getInitialBackoff(),
                        retry.getMultiplier(),
                        retry.getJitterFactor(),
                        retry.getMaxBackoff()));
    }

    /** Delay before the attempt following {@code failedAttempt} (1-based). */
    public long delayMillis(int failedAttempt) {
        return backoff.apply(failedAttempt);
    }
}

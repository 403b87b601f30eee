package com.partsbin.integration.inventory;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff.
 *
 * @param maxAttempts  total attempts including the first, at least 1
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor applied to each further delay
 * @param maxDelay     cap on any single delay, not below {@code initialDelay}
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(200);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(2);

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay %s is below initialDelay %s".formatted(maxDelay, initialDelay));
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY);
    }

    /**
     * Wait after each failed attempt (1-based). A zero initial delay retries immediately.
     */
    public IntervalFunction intervalFunction() {
        if (initialDelay.isZero()) {
            return attempt -> 0L;
        }
        return IntervalFunction.ofExponentialBackoff(initialDelay, multiplier, maxDelay);
    }

    /**
     * Only {@link IOException}s are retried; anything else fails on the first attempt.
     */
    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(intervalFunction())
            .retryExceptions(IOException.class)
            .build();
    }
}

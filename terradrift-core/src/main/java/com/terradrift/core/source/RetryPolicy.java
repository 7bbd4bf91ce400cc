package com.terradrift.core.source;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Exponential backoff bounded by a total elapsed-time budget.
 *
 * <p>The n-th retry waits {@code baseDelay * multiplier^(n-1)}. Retries stop once the sum of
 * waits would exceed {@code maxElapsedTime}.
 *
 * @param maxElapsedTime total time budget for waiting between attempts
 * @param baseDelay wait before the first retry
 * @param multiplier growth factor between successive waits (at least 1.0)
 */
public record RetryPolicy(
    Duration maxElapsedTime,
    Duration baseDelay,
    double multiplier
) {
    private static final int MAX_ATTEMPTS_CAP = 100;

    /**
     * Compact constructor with validation.
     */
    public RetryPolicy {
        Objects.requireNonNull(maxElapsedTime, "maxElapsedTime must not be null");
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (maxElapsedTime.isNegative()) {
            throw new IllegalArgumentException("maxElapsedTime must not be negative");
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
    }

    /**
     * 30 s budget, 500 ms first wait, 1.5x growth.
     *
     * @return default policy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(30), Duration.ofMillis(500), 1.5);
    }

    /**
     * A policy that makes a single attempt.
     *
     * @return no-retry policy
     */
    public static RetryPolicy none() {
        return new RetryPolicy(Duration.ZERO, Duration.ofMillis(10), 1.0);
    }

    /**
     * Number of attempts (first call plus retries) whose waits fit into the budget.
     *
     * @return max attempts, at least 1
     */
    public int maxAttempts() {
        long budget = maxElapsedTime.toMillis();
        double wait = baseDelay.toMillis();
        long spent = 0;
        int attempts = 1;
        while (attempts < MAX_ATTEMPTS_CAP && spent + (long) wait <= budget) {
            spent += (long) wait;
            attempts++;
            wait *= multiplier;
        }
        return attempts;
    }

    /**
     * Builds the resilience4j configuration for this policy.
     *
     * @param retryOn predicate selecting transient failures
     * @return retry configuration
     */
    public RetryConfig toRetryConfig(Predicate<Throwable> retryOn) {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay, multiplier))
            .retryOnException(retryOn)
            .build();
    }
}

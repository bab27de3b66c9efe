package com.marketvault.data.fetch;

import com.marketvault.data.exception.RateLimitedException;

import java.time.Duration;

/**
 * Bounded exponential backoff for page requests.
 *
 * @param maxAttempts    total attempts per page, including the first
 * @param initialBackoff wait after the first failure, doubled each attempt
 * @param maxBackoff     cap on a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(30));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Wait before attempt {@code failedAttempt + 1}.
     * A rate-limit rejection waits at least as long as the exchange asked.
     */
    public Duration delayAfter(int failedAttempt, Exception failure) {
        long factor = 1L << Math.min(failedAttempt - 1, 20);
        Duration delay = initialBackoff.multipliedBy(factor);
        if (delay.compareTo(maxBackoff) > 0) {
            delay = maxBackoff;
        }
        if (failure instanceof RateLimitedException rate) {
            Duration retryAfter = Duration.ofMillis(rate.getRetryAfterMs());
            if (retryAfter.compareTo(delay) > 0) {
                delay = retryAfter;
            }
        }
        return delay;
    }
}

package com.marketvault.data.fetch;

import java.time.Duration;

/**
 * Bounds the rate of outbound API requests.
 * One instance is shared by every worker talking to the same exchange.
 */
public interface RateLimiter {

    /**
     * Acquire permission to make a request, blocking as long as needed.
     */
    void acquire() throws InterruptedException;

    /**
     * Acquire permission if it can be granted within {@code timeout}.
     *
     * @return true if permission was acquired, false if the wait would exceed the timeout
     */
    boolean tryAcquire(Duration timeout) throws InterruptedException;

    /**
     * Limiter that never waits. Useful for tests and local replay.
     */
    static RateLimiter unlimited() {
        return Unlimited.INSTANCE;
    }

    /**
     * Token bucket allowing {@code permits} requests per {@code period}.
     */
    static RateLimiter tokenBucket(int permits, Duration period) {
        return new TokenBucketRateLimiter(permits, period);
    }
}

/**
 * No-op limiter.
 */
enum Unlimited implements RateLimiter {
    INSTANCE;

    @Override
    public void acquire() {
    }

    @Override
    public boolean tryAcquire(Duration timeout) {
        return true;
    }
}

package com.marketvault.data.fetch;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket rate limiter: up to {@code permits} requests per {@code period},
 * refilled continuously.
 *
 * Callers reserve a token under the lock and sleep outside it, so a waiting
 * worker never blocks another worker's reservation. Reservations are served
 * in arrival order.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private final int capacity;
    private final double nanosPerPermit;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    // May go negative: outstanding reservations not yet covered by refill
    private double available;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int permits, Duration period) {
        this(permits, period, System::nanoTime, Sleeper.SYSTEM);
    }

    TokenBucketRateLimiter(int permits, Duration period, LongSupplier nanoClock, Sleeper sleeper) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1");
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.capacity = permits;
        this.nanosPerPermit = (double) period.toNanos() / permits;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.available = permits;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    @Override
    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            waitNanos = reserve();
        }
        if (waitNanos > 0) {
            sleeper.sleepNanos(waitNanos);
        }
    }

    @Override
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            refill();
            long needed = waitFor(available - 1);
            if (needed > timeout.toNanos()) {
                return false;
            }
            waitNanos = reserve();
        }
        if (waitNanos > 0) {
            sleeper.sleepNanos(waitNanos);
        }
        return true;
    }

    /**
     * Tokens currently available (negative while reservations are pending).
     */
    synchronized double availablePermits() {
        refill();
        return available;
    }

    private long reserve() {
        refill();
        available -= 1;
        return waitFor(available);
    }

    private long waitFor(double balance) {
        return balance >= 0 ? 0 : (long) Math.ceil(-balance * nanosPerPermit);
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            available = Math.min(capacity, available + elapsed / nanosPerPermit);
            lastRefillNanos = now;
        }
    }
}

package com.marketvault.data.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    @Nested
    @DisplayName("With a manual clock")
    class ManualClock {

        private final AtomicLong nanos = new AtomicLong(1_000_000L);
        private final List<Long> sleeps = new ArrayList<>();
        private final TokenBucketRateLimiter limiter =
            new TokenBucketRateLimiter(2, Duration.ofSeconds(1), nanos::get, sleeps::add);

        @Test
        @DisplayName("Burst up to capacity without waiting")
        void burstWithinCapacity() throws InterruptedException {
            limiter.acquire();
            limiter.acquire();

            assertTrue(sleeps.isEmpty());
            assertEquals(0.0, limiter.availablePermits(), 1e-9);
        }

        @Test
        @DisplayName("Request beyond capacity waits for one refill interval")
        void waitsWhenEmpty() throws InterruptedException {
            limiter.acquire();
            limiter.acquire();
            limiter.acquire();

            assertEquals(List.of(TimeUnit.MILLISECONDS.toNanos(500)), sleeps);
            assertEquals(-1.0, limiter.availablePermits(), 1e-9);
        }

        @Test
        @DisplayName("Refill never exceeds capacity")
        void refillCapped() throws InterruptedException {
            limiter.acquire();
            nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));

            assertEquals(2.0, limiter.availablePermits(), 1e-9);
        }

        @Test
        @DisplayName("tryAcquire gives up when the wait exceeds the timeout")
        void tryAcquireTimeout() throws InterruptedException {
            limiter.acquire();
            limiter.acquire();

            assertFalse(limiter.tryAcquire(Duration.ofMillis(100)));
            assertEquals(0.0, limiter.availablePermits(), 1e-9);
            assertTrue(limiter.tryAcquire(Duration.ofSeconds(1)));
            assertEquals(1, sleeps.size());
        }
    }

    @Test
    @DisplayName("Shared limiter bounds the total rate across threads")
    void sharedAcrossThreads() throws Exception {
        RateLimiter limiter = RateLimiter.tokenBucket(5, Duration.ofMillis(200));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);

        long start = System.nanoTime();
        for (int i = 0; i < 4; i++) {
            pool.submit(() -> {
                try {
                    for (int j = 0; j < 5; j++) {
                        limiter.acquire();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        pool.shutdownNow();

        // 20 permits, 5 up front, then one every 40 ms
        assertTrue(elapsedMs >= 550, "finished too fast: " + elapsedMs + " ms");
    }

    @Test
    @DisplayName("Invalid configuration is rejected")
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(1, Duration.ZERO));
    }
}

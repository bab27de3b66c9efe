package com.marketvault.data.fetch;

import com.marketvault.data.exception.NetworkException;
import com.marketvault.data.exception.RateLimitedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.defaults();
    private final NetworkException network = new NetworkException("connection reset");

    @Test
    @DisplayName("Backoff doubles after each failure")
    void exponentialBackoff() {
        assertEquals(Duration.ofMillis(500), policy.delayAfter(1, network));
        assertEquals(Duration.ofMillis(1000), policy.delayAfter(2, network));
        assertEquals(Duration.ofMillis(2000), policy.delayAfter(3, network));
    }

    @Test
    @DisplayName("Backoff is capped")
    void backoffCapped() {
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(10, network));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(60, network));
    }

    @Test
    @DisplayName("Rate limit waits at least the retry-after")
    void rateLimitHonoursRetryAfter() {
        assertEquals(Duration.ofSeconds(5), policy.delayAfter(1, new RateLimitedException("429", 5000)));
        // Backoff already longer than retry-after
        assertEquals(Duration.ofSeconds(2), policy.delayAfter(3, new RateLimitedException("429", 100)));
    }

    @Test
    @DisplayName("At least one attempt is required")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
    }
}

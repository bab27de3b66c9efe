package com.marketvault.data.exception;

/**
 * The exchange rejected a request because its rate limit was exceeded.
 */
public class RateLimitedException extends MarketDataException {

    private final long retryAfterMs;

    public RateLimitedException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    /**
     * Minimum wait requested by the exchange, 0 if it did not say.
     */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}

package com.marketvault.data.exchange;

import com.marketvault.core.model.DataType;

import java.time.Duration;

/**
 * Parameters of a single page request.
 *
 * @param since   first timestamp (ms, inclusive) the page may contain
 * @param limit   maximum number of records requested
 * @param timeout budget for the whole call
 */
public record PageRequest(
    String exchange,
    DataType dataType,
    String subTypeId,
    String symbol,
    long since,
    int limit,
    Duration timeout
) {
    public PageRequest {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }

    public PageRequest withSince(long newSince, int newLimit) {
        return new PageRequest(exchange, dataType, subTypeId, symbol, newSince, newLimit, timeout);
    }
}

package com.marketvault.data.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketvault.core.model.DataType;
import com.marketvault.data.exception.MarketDataException;
import com.marketvault.data.exception.NetworkException;
import com.marketvault.data.exception.RateLimitedException;

import java.util.List;
import java.util.Set;

/**
 * Remote exchange capability consumed by the downloader.
 *
 * Pages are returned in a unified raw shape:
 * <ul>
 *   <li>candles: arrays {@code [timestamp, open, high, low, close, volume]}</li>
 *   <li>trades: objects {@code {id, timestamp, side, price, amount, cost?}}</li>
 *   <li>funding: objects {@code {timestamp, fundingRate, markPrice?}}</li>
 * </ul>
 * Numbers may be JSON numbers or numeric strings. Records are ordered by timestamp
 * ascending and start at or after {@link PageRequest#since()}.
 */
public interface MarketDataApi {

    /**
     * List the symbols tradable on an exchange.
     */
    Set<String> listSymbols(String exchange) throws MarketDataException;

    /**
     * Fetch one page of raw records.
     *
     * @throws RateLimitedException if the exchange throttled the request
     * @throws NetworkException     on transport errors, timeouts or server errors
     * @throws MarketDataException  on non-retryable errors (unknown symbol, unsupported data type)
     */
    List<JsonNode> fetchPage(PageRequest request) throws MarketDataException;

    /**
     * Largest page the exchange serves for a data type. A request with a larger
     * limit comes back capped, so callers must not read such a page as short.
     */
    default int maxPageSize(DataType dataType) {
        return Integer.MAX_VALUE;
    }
}

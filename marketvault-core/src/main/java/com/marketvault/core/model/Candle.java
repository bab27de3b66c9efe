package com.marketvault.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * OHLCV candle. The timestamp is the candle open time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Candle(
    String symbol,
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) implements MarketRecord {

    /**
     * Price range of the candle (high - low).
     */
    @JsonIgnore
    public double range() {
        return high - low;
    }

    /**
     * True if close is above open.
     */
    @JsonIgnore
    public boolean isBullish() {
        return close > open;
    }
}

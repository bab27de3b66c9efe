package com.marketvault.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Funding rate settlement of a perpetual contract.
 * Most venues settle every 8 hours.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FundingRate(
    String symbol,           // e.g., "BTC/USDT:USDT"
    long timestamp,          // settlement time in milliseconds
    double fundingRate,      // e.g., 0.0001 = 0.01%
    double markPrice         // mark price at settlement, NaN when not reported
) implements MarketRecord {

    /**
     * Get funding rate as percentage (e.g., 0.0001 -> 0.01)
     */
    @JsonIgnore
    public double fundingRatePercent() {
        return fundingRate * 100;
    }

    /**
     * Positive funding: longs pay shorts.
     */
    @JsonIgnore
    public boolean isPositive() {
        return fundingRate > 0;
    }
}

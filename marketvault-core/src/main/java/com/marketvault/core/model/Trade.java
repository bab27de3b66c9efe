package com.marketvault.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Public trade print.
 *
 * side: "buy" when the taker bought (up-tick), "sell" when the taker sold.
 * cost: notional in quote currency (price * amount unless the exchange reports it).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    String symbol,
    long timestamp,
    String id,
    String side,
    double price,
    double amount,
    double cost
) implements MarketRecord {

    public static final String BUY = "buy";
    public static final String SELL = "sell";

    public Trade {
        if (id == null) id = "";
        if (side == null) side = "";
    }

    /**
     * Trades sharing a millisecond are told apart by id.
     */
    @Override
    public RecordKey key() {
        return new RecordKey(timestamp, symbol, id);
    }
}

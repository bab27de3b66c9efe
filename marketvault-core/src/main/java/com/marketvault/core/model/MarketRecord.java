package com.marketvault.core.model;

/**
 * Canonical unit of persisted market data.
 * Every record carries the time it refers to and the symbol it belongs to;
 * the remaining fields depend on the {@link DataType}.
 */
public interface MarketRecord {

    /**
     * Unix timestamp in milliseconds (UTC).
     */
    long timestamp();

    /**
     * Symbol in exchange format, e.g. "BTC/USDT" or "BTCUSDT".
     */
    String symbol();

    /**
     * Identity used for deduplication inside a partition.
     */
    default RecordKey key() {
        return new RecordKey(timestamp(), symbol(), "");
    }
}

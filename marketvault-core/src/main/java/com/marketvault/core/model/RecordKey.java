package com.marketvault.core.model;

import java.util.Comparator;

/**
 * Deduplication key of a {@link MarketRecord}.
 *
 * For candles and funding rates the discriminator is empty, so the key is exactly
 * (timestamp, symbol). Trades carry the exchange trade id as discriminator since
 * several trades can share one millisecond.
 */
public record RecordKey(long timestamp, String symbol, String discriminator) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
        .comparingLong(RecordKey::timestamp)
        .thenComparing(RecordKey::symbol)
        .thenComparing(RecordKey::discriminator);

    public RecordKey {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol must not be null");
        }
        if (discriminator == null) discriminator = "";
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }
}

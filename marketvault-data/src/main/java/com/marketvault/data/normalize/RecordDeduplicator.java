package com.marketvault.data.normalize;

import com.marketvault.core.model.MarketRecord;
import com.marketvault.core.model.RecordKey;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Merges record batches keeping one record per {@link RecordKey}.
 *
 * When both sides carry the same key the incoming record wins, since it comes
 * from the most recent fetch. Output is ordered by timestamp ascending, which
 * readers of stored partitions rely on.
 */
public final class RecordDeduplicator {

    private RecordDeduplicator() {
    }

    /**
     * Merge {@code incoming} over {@code existing}.
     */
    public static List<MarketRecord> dedup(List<? extends MarketRecord> existing,
                                           List<? extends MarketRecord> incoming) {
        TreeMap<RecordKey, MarketRecord> merged = new TreeMap<>();
        for (MarketRecord record : existing) {
            merged.put(record.key(), record);
        }
        for (MarketRecord record : incoming) {
            merged.put(record.key(), record);
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Deduplicate a single batch; later occurrences win.
     */
    public static List<MarketRecord> dedup(List<? extends MarketRecord> records) {
        return dedup(List.of(), records);
    }
}

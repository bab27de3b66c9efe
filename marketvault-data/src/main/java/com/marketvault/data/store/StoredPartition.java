package com.marketvault.data.store;

import com.marketvault.core.model.MarketRecord;

import java.util.List;

/**
 * A partition read back from disk: its header and records ordered by timestamp.
 */
public record StoredPartition(PartitionHeader header, List<MarketRecord> records) {

    public boolean complete() {
        return header.complete();
    }

    /**
     * Timestamp of the last record, or -1 if the partition is empty.
     */
    public long lastTimestamp() {
        return records.isEmpty() ? -1 : records.get(records.size() - 1).timestamp();
    }
}

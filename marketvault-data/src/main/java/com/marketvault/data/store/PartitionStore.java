package com.marketvault.data.store;

import com.marketvault.core.model.DataType;
import com.marketvault.core.model.MarketRecord;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Durable storage of partitions.
 *
 * Writes replace a partition as a whole and become visible in one step; callers
 * merge in memory before writing. Concurrent writes to different partitions are
 * safe; callers must not write the same partition concurrently.
 */
public interface PartitionStore {

    /**
     * Whether a partition is present and marked complete.
     * A partition whose header cannot be read reports {@link PartitionStatus#ABSENT}.
     */
    PartitionStatus status(PartitionId id) throws IOException;

    /**
     * Read a partition.
     *
     * @throws PartitionNotFoundException if nothing is stored for {@code id}
     */
    StoredPartition read(PartitionId id) throws IOException;

    /**
     * Atomically replace the partition with {@code records} (must be sorted by timestamp).
     */
    void write(PartitionId id, List<? extends MarketRecord> records, boolean complete) throws IOException;

    /**
     * Symbols with at least one stored partition for the exchange, data type and sub-type.
     */
    Set<String> listSymbols(String exchange, DataType dataType, String subTypeId) throws IOException;

    /**
     * Stored partition keys for one symbol, ascending.
     */
    List<LocalDate> listPartitionKeys(String exchange, DataType dataType, String subTypeId, String symbol)
        throws IOException;
}

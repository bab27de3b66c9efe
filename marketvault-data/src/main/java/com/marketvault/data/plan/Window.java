package com.marketvault.data.plan;

import com.marketvault.core.model.PartitionSpan;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A bounded time range fetched in one logical operation.
 * Maps to the partition {@code partitionKey}; {@code [start, end)} never crosses
 * a partition boundary but may cover only part of the partition.
 */
public record Window(LocalDate partitionKey, Instant start, Instant end, PartitionSpan span) {

    public Window {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " >= " + end);
        }
    }

    public long startMillis() {
        return start.toEpochMilli();
    }

    public long endMillis() {
        return end.toEpochMilli();
    }

    public Instant partitionStart() {
        return span.start(partitionKey);
    }

    public Instant partitionEnd() {
        return span.end(partitionKey);
    }

    /**
     * True if the window spans its whole partition period.
     */
    public boolean coversPartition() {
        return start.equals(partitionStart()) && end.equals(partitionEnd());
    }

    @Override
    public String toString() {
        return partitionKey + "[" + start + " - " + end + ")";
    }
}

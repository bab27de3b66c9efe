package com.marketvault.core.model;

import java.util.Set;

/**
 * Supported kinds of market data.
 * Each type fixes its valid sub-type ids, how its history is split into
 * partitions and how the page cursor advances past the last record seen.
 */
public enum DataType {
    /**
     * OHLCV candles. Sub-type is the timeframe ("1m", "1h", ...).
     * Fine timeframes are partitioned per day, coarser ones per month or year
     * so that a partition stays within a couple of API pages.
     */
    CANDLES("candles", "1m"),

    /**
     * Public trades. One partition per day.
     */
    TRADES("trades", "default"),

    /**
     * Funding rate settlements (every 8h on most venues). One partition per month.
     */
    FUNDING("funding", "default");

    public static final String DEFAULT_SUB_TYPE = "default";

    private final String id;
    private final String defaultSubTypeId;

    DataType(String id, String defaultSubTypeId) {
        this.id = id;
        this.defaultSubTypeId = defaultSubTypeId;
    }

    /**
     * Lower-case id used in paths and options ("candles", "trades", "funding").
     */
    public String id() {
        return id;
    }

    public String defaultSubTypeId() {
        return defaultSubTypeId;
    }

    /**
     * Check if this data type is parameterized by a timeframe.
     */
    public boolean requiresTimeframe() {
        return this == CANDLES;
    }

    public Set<String> validSubTypeIds() {
        return requiresTimeframe() ? Timeframe.ids() : Set.of(DEFAULT_SUB_TYPE);
    }

    /**
     * Validate a sub-type id, substituting the default for null.
     *
     * @throws IllegalArgumentException if the id is not valid for this type
     */
    public String resolveSubType(String subTypeId) {
        if (subTypeId == null || subTypeId.isBlank()) {
            return defaultSubTypeId;
        }
        if (!validSubTypeIds().contains(subTypeId)) {
            throw new IllegalArgumentException("Sub-type '" + subTypeId + "' is not valid for " + id
                + ", expected one of " + validSubTypeIds());
        }
        return subTypeId;
    }

    /**
     * Partition size policy.
     */
    public PartitionSpan partitionSpan(String subTypeId) {
        return switch (this) {
            case CANDLES -> {
                long minutes = Timeframe.fromId(resolveSubType(subTypeId)).duration().toMinutes();
                if (minutes < 60) yield PartitionSpan.DAY;
                if (minutes < 24 * 60) yield PartitionSpan.MONTH;
                yield PartitionSpan.YEAR;
            }
            case TRADES -> PartitionSpan.DAY;
            case FUNDING -> PartitionSpan.MONTH;
        };
    }

    /**
     * Cursor for the next page request given the timestamp of the last record received.
     * Candles jump to the next open time, other types move one millisecond on.
     */
    public long advanceCursor(long lastTimestamp, String subTypeId) {
        if (this == CANDLES) {
            return Timeframe.fromId(resolveSubType(subTypeId)).next(lastTimestamp);
        }
        return lastTimestamp + 1;
    }

    public static DataType fromId(String id) {
        for (DataType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + id);
    }
}

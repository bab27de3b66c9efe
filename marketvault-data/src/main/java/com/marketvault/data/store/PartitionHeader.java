package com.marketvault.data.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Metadata stored at the start of every partition file.
 * Written as a single msgpack blob so {@code status} can stop reading after it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PartitionHeader(
    String format,
    int version,
    String exchange,
    String symbol,
    String dataType,
    String subTypeId,
    boolean complete,
    int rowCount,
    long firstTimestamp,
    long lastTimestamp,
    long writtenAt,
    List<String> columns
) {
    public static final String FORMAT = "marketvault-columnar";
    public static final int VERSION = 1;
}

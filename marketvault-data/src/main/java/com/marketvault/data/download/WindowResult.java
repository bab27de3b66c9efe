package com.marketvault.data.download;

import com.marketvault.data.plan.Window;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Result for one (symbol, sub-type, window).
 */
public record WindowResult(
    String symbol,
    String subTypeId,
    LocalDate partitionKey,
    Instant windowStart,
    Instant windowEnd,
    WindowStatus status,
    int recordCount,
    boolean complete,
    String message
) {
    public static WindowResult fetched(String symbol, String subTypeId, Window window, int recordCount,
                                       boolean complete) {
        return of(symbol, subTypeId, window, WindowStatus.FETCHED, recordCount, complete, null);
    }

    public static WindowResult skipped(String symbol, String subTypeId, Window window) {
        return of(symbol, subTypeId, window, WindowStatus.SKIPPED, 0, true, null);
    }

    public static WindowResult failed(String symbol, String subTypeId, Window window, String message) {
        return of(symbol, subTypeId, window, WindowStatus.FAILED, 0, false, message);
    }

    public static WindowResult outOfRange(String symbol, String subTypeId, Window window) {
        return of(symbol, subTypeId, window, WindowStatus.OUT_OF_RANGE, 0, false,
            "No data returned for past window " + window + "; the exchange may not serve it");
    }

    public static WindowResult cancelled(String symbol, String subTypeId, Window window) {
        return of(symbol, subTypeId, window, WindowStatus.CANCELLED, 0, false, null);
    }

    private static WindowResult of(String symbol, String subTypeId, Window window, WindowStatus status,
                                   int recordCount, boolean complete, String message) {
        return new WindowResult(symbol, subTypeId, window.partitionKey(), window.start(), window.end(),
            status, recordCount, complete, message);
    }
}

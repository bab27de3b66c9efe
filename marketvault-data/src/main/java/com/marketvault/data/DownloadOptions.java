package com.marketvault.data;

import com.marketvault.core.model.DataType;
import com.marketvault.data.fetch.RateLimiter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call options for {@link MarketVault#download}.
 *
 * @param subTypeIds  sub-type ids per data type, e.g. candle timeframes; missing types use their default
 * @param rateLimiter limiter replacing the configured one for this call, or null
 * @param parallelism worker count replacing the configured one for this call, or null
 * @param cancelled   flag that stops dispatching new windows once set, or null
 */
public record DownloadOptions(
    Map<DataType, List<String>> subTypeIds,
    RateLimiter rateLimiter,
    Integer parallelism,
    AtomicBoolean cancelled
) {
    public DownloadOptions {
        EnumMap<DataType, List<String>> copy = new EnumMap<>(DataType.class);
        if (subTypeIds != null) {
            subTypeIds.forEach((type, ids) -> copy.put(type, List.copyOf(ids)));
        }
        subTypeIds = copy;
        if (parallelism != null && parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    public static DownloadOptions defaults() {
        return new DownloadOptions(Map.of(), null, null, null);
    }

    /**
     * Copy with the sub-type ids for one data type replaced, e.g.
     * {@code withSubTypes(DataType.CANDLES, "1m", "1h")}.
     */
    public DownloadOptions withSubTypes(DataType dataType, String... ids) {
        Map<DataType, List<String>> updated = new EnumMap<>(DataType.class);
        updated.putAll(subTypeIds);
        updated.put(dataType, List.of(ids));
        return new DownloadOptions(updated, rateLimiter, parallelism, cancelled);
    }

    public DownloadOptions withRateLimiter(RateLimiter limiter) {
        return new DownloadOptions(subTypeIds, limiter, parallelism, cancelled);
    }

    public DownloadOptions withParallelism(int workers) {
        return new DownloadOptions(subTypeIds, rateLimiter, workers, cancelled);
    }

    public DownloadOptions withCancellation(AtomicBoolean flag) {
        return new DownloadOptions(subTypeIds, rateLimiter, parallelism, flag);
    }

    public List<String> subTypesFor(DataType dataType) {
        return subTypeIds.getOrDefault(dataType, List.of());
    }

    /**
     * True if this call needs its own fetcher and worker pool.
     */
    boolean overridesWorkers() {
        return rateLimiter != null || parallelism != null;
    }
}

package com.marketvault.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Candle aggregation windows supported by the downloader.
 * Ids follow the common exchange notation ("1m", "4h", "1d", "1M").
 */
public enum Timeframe {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    THREE_MINUTES("3m", Duration.ofMinutes(3)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    TWO_HOURS("2h", Duration.ofHours(2)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    SIX_HOURS("6h", Duration.ofHours(6)),
    EIGHT_HOURS("8h", Duration.ofHours(8)),
    TWELVE_HOURS("12h", Duration.ofHours(12)),
    ONE_DAY("1d", Duration.ofDays(1)),
    THREE_DAYS("3d", Duration.ofDays(3)),
    ONE_WEEK("1w", Duration.ofDays(7)),
    ONE_MONTH("1M", Duration.ofDays(30));

    private static final Set<String> IDS = Arrays.stream(values())
        .map(Timeframe::id)
        .collect(Collectors.toCollection(LinkedHashSet::new));

    private final String id;
    private final Duration duration;

    Timeframe(String id, Duration duration) {
        this.id = id;
        this.duration = duration;
    }

    public String id() {
        return id;
    }

    /**
     * Nominal length. Months are counted as 30 days, which is only used for sizing.
     */
    public Duration duration() {
        return duration;
    }

    public long millis() {
        return duration.toMillis();
    }

    /**
     * Open time of the candle following the one opened at {@code openTime}.
     */
    public long next(long openTime) {
        if (this == ONE_MONTH) {
            ZonedDateTime open = Instant.ofEpochMilli(openTime).atZone(ZoneOffset.UTC);
            return open.plusMonths(1).toInstant().toEpochMilli();
        }
        return openTime + duration.toMillis();
    }

    /**
     * Resolve a timeframe id. Ids are case sensitive: "1m" is a minute, "1M" a month.
     */
    public static Timeframe fromId(String id) {
        for (Timeframe tf : values()) {
            if (tf.id.equals(id)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe '" + id + "', expected one of " + IDS);
    }

    public static Set<String> ids() {
        return IDS;
    }
}

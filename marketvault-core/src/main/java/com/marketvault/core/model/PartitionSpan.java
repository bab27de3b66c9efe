package com.marketvault.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Calendar period covered by one persisted partition (UTC).
 * A partition is keyed by the date its period starts on.
 */
public enum PartitionSpan {
    DAY(Duration.ofDays(1)),
    MONTH(Duration.ofDays(31)),
    YEAR(Duration.ofDays(366));

    private final Duration maxLength;

    PartitionSpan(Duration maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * Longest possible period (31 days for a month, 366 for a year).
     */
    public Duration maxLength() {
        return maxLength;
    }

    /**
     * Partition key of the period containing {@code instant}.
     */
    public LocalDate keyOf(Instant instant) {
        LocalDate date = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return switch (this) {
            case DAY -> date;
            case MONTH -> date.withDayOfMonth(1);
            case YEAR -> date.withDayOfYear(1);
        };
    }

    /**
     * Start instant of the partition identified by {@code key}.
     */
    public Instant start(LocalDate key) {
        return key.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * End instant (exclusive) of the partition identified by {@code key}.
     */
    public Instant end(LocalDate key) {
        LocalDate next = switch (this) {
            case DAY -> key.plusDays(1);
            case MONTH -> key.plusMonths(1);
            case YEAR -> key.plusYears(1);
        };
        return start(next);
    }

    public Instant floor(Instant instant) {
        return start(keyOf(instant));
    }

    /**
     * Smallest partition boundary at or after {@code instant}.
     */
    public Instant ceil(Instant instant) {
        Instant floor = floor(instant);
        return floor.equals(instant) ? instant : end(keyOf(instant));
    }
}

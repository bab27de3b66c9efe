package com.marketvault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class PartitionSpanTest {

    private static final Instant MID_MONTH = Instant.parse("2023-09-15T13:45:00Z");

    @Test
    @DisplayName("Keys are the first day of the period")
    void keysArePeriodStarts() {
        assertEquals(LocalDate.of(2023, 9, 15), PartitionSpan.DAY.keyOf(MID_MONTH));
        assertEquals(LocalDate.of(2023, 9, 1), PartitionSpan.MONTH.keyOf(MID_MONTH));
        assertEquals(LocalDate.of(2023, 1, 1), PartitionSpan.YEAR.keyOf(MID_MONTH));
    }

    @Test
    @DisplayName("Month end follows the calendar")
    void monthEndFollowsCalendar() {
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), PartitionSpan.MONTH.end(LocalDate.of(2024, 2, 1)));
    }

    @Test
    @DisplayName("Floor and ceil snap to partition boundaries")
    void floorAndCeil() {
        assertEquals(Instant.parse("2023-09-15T00:00:00Z"), PartitionSpan.DAY.floor(MID_MONTH));
        assertEquals(Instant.parse("2023-09-16T00:00:00Z"), PartitionSpan.DAY.ceil(MID_MONTH));
        Instant boundary = Instant.parse("2023-09-16T00:00:00Z");
        assertEquals(boundary, PartitionSpan.DAY.ceil(boundary));
    }
}

package com.marketvault.data.plan;

import com.marketvault.core.model.DataType;
import com.marketvault.core.model.PartitionSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a requested range into fetch windows, one per partition.
 *
 * Windows are contiguous, do not overlap and cover exactly the requested range
 * after the end has been clamped to "now". Interior boundaries fall on partition
 * boundaries of the data type's {@link PartitionSpan}; the first and last window
 * may be partial.
 */
public class WindowPlanner {

    private static final Logger log = LoggerFactory.getLogger(WindowPlanner.class);

    private final Clock clock;

    public WindowPlanner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Plan windows covering {@code [start, end)}.
     * An empty or inverted range (after clamping) yields an empty plan.
     */
    public List<Window> plan(DataType dataType, String subTypeId, Instant start, Instant end) {
        PartitionSpan span = dataType.partitionSpan(subTypeId);
        Instant now = clock.instant();
        Instant effectiveEnd = end.isAfter(now) ? now : end;

        if (!start.isBefore(effectiveEnd)) {
            log.debug("Empty plan for {} {}: start {} is not before end {}", dataType.id(), subTypeId, start, effectiveEnd);
            return Collections.emptyList();
        }

        List<Window> windows = new ArrayList<>();
        Instant current = start;
        while (current.isBefore(effectiveEnd)) {
            LocalDate key = span.keyOf(current);
            Instant partitionEnd = span.end(key);
            Instant windowEnd = partitionEnd.isBefore(effectiveEnd) ? partitionEnd : effectiveEnd;
            windows.add(new Window(key, current, windowEnd, span));
            current = windowEnd;
        }
        return windows;
    }

    /**
     * Plan whole partitions for a date range: the start date is floored and the end
     * date ceiled to partition boundaries, so each window (except one still open at
     * "now") covers a full partition.
     *
     * @param startDate first day requested (inclusive)
     * @param endDate   last day requested (exclusive)
     */
    public List<Window> planPartitions(DataType dataType, String subTypeId, LocalDate startDate, LocalDate endDate) {
        if (!startDate.isBefore(endDate)) {
            log.debug("Empty plan for {} {}: {} is not before {}", dataType.id(), subTypeId, startDate, endDate);
            return Collections.emptyList();
        }
        PartitionSpan span = dataType.partitionSpan(subTypeId);
        Instant start = span.floor(startDate.atStartOfDay(ZoneOffset.UTC).toInstant());
        Instant end = span.ceil(endDate.atStartOfDay(ZoneOffset.UTC).toInstant());
        return plan(dataType, subTypeId, start, end);
    }
}

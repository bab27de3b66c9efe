package com.marketvault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DataType policies.
 */
class DataTypeTest {

    @Nested
    @DisplayName("Sub-type resolution")
    class SubTypeTests {

        @Test
        @DisplayName("Candles default to 1m when no timeframe is given")
        void candlesDefaultToOneMinute() {
            assertEquals("1m", DataType.CANDLES.resolveSubType(null));
            assertEquals("1m", DataType.CANDLES.resolveSubType(" "));
        }

        @Test
        @DisplayName("Rejects unknown timeframe for candles")
        void rejectsUnknownTimeframe() {
            assertThrows(IllegalArgumentException.class, () -> DataType.CANDLES.resolveSubType("7m"));
        }

        @Test
        @DisplayName("Trades and funding only accept the default sub-type")
        void tradesOnlyAcceptDefault() {
            assertEquals("default", DataType.TRADES.resolveSubType(null));
            assertEquals("default", DataType.FUNDING.resolveSubType("default"));
            assertThrows(IllegalArgumentException.class, () -> DataType.TRADES.resolveSubType("1h"));
        }

        @Test
        @DisplayName("Parses ids case-insensitively")
        void parsesIds() {
            assertEquals(DataType.CANDLES, DataType.fromId("candles"));
            assertEquals(DataType.FUNDING, DataType.fromId("FUNDING"));
            assertThrows(IllegalArgumentException.class, () -> DataType.fromId("orderbook"));
        }
    }

    @Nested
    @DisplayName("Partition policy")
    class PartitionPolicyTests {

        @Test
        @DisplayName("Minute candles are partitioned per day")
        void minuteCandlesPerDay() {
            assertEquals(PartitionSpan.DAY, DataType.CANDLES.partitionSpan("1m"));
            assertEquals(PartitionSpan.DAY, DataType.CANDLES.partitionSpan("30m"));
        }

        @Test
        @DisplayName("Hourly candles are partitioned per month, daily and above per year")
        void coarseCandlesSpanLonger() {
            assertEquals(PartitionSpan.MONTH, DataType.CANDLES.partitionSpan("1h"));
            assertEquals(PartitionSpan.MONTH, DataType.CANDLES.partitionSpan("12h"));
            assertEquals(PartitionSpan.YEAR, DataType.CANDLES.partitionSpan("1d"));
            assertEquals(PartitionSpan.YEAR, DataType.CANDLES.partitionSpan("1M"));
        }

        @Test
        @DisplayName("Trades per day, funding per month")
        void tradesAndFunding() {
            assertEquals(PartitionSpan.DAY, DataType.TRADES.partitionSpan(null));
            assertEquals(PartitionSpan.MONTH, DataType.FUNDING.partitionSpan(null));
        }
    }

    @Nested
    @DisplayName("Cursor advance")
    class CursorTests {

        @Test
        @DisplayName("Candle cursor jumps to the next open time")
        void candleCursorJumpsOneTimeframe() {
            assertEquals(60_000L + 1_000L, DataType.CANDLES.advanceCursor(1_000L, "1m"));
            assertEquals(3_600_000L, DataType.CANDLES.advanceCursor(0L, "1h"));
        }

        @Test
        @DisplayName("Monthly candle cursor follows calendar months")
        void monthlyCursorFollowsCalendar() {
            long feb = Instant.parse("2024-02-01T00:00:00Z").toEpochMilli();
            long mar = Instant.parse("2024-03-01T00:00:00Z").toEpochMilli();
            assertEquals(mar, DataType.CANDLES.advanceCursor(feb, "1M"));
        }

        @Test
        @DisplayName("Trade and funding cursors advance one millisecond")
        void otherCursorsAdvanceOneMilli() {
            assertEquals(1001L, DataType.TRADES.advanceCursor(1000L, null));
            assertEquals(1001L, DataType.FUNDING.advanceCursor(1000L, null));
        }
    }
}

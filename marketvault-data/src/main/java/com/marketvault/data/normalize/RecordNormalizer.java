package com.marketvault.data.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketvault.core.model.Candle;
import com.marketvault.core.model.DataType;
import com.marketvault.core.model.FundingRate;
import com.marketvault.core.model.MarketRecord;
import com.marketvault.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Maps raw API pages into canonical records, ordered by timestamp.
 * Malformed rows are dropped and counted rather than failing the page.
 */
public class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    /**
     * Normalize a raw page for {@code symbol}.
     *
     * @param dataType selects the row parser
     * @param rawPage  rows in the unified raw shape (see MarketDataApi)
     * @return records sorted by timestamp ascending
     */
    public List<MarketRecord> normalize(DataType dataType, String symbol, List<JsonNode> rawPage) {
        List<MarketRecord> records = new ArrayList<>(rawPage.size());
        int malformed = 0;

        for (JsonNode row : rawPage) {
            try {
                records.add(switch (dataType) {
                    case CANDLES -> toCandle(symbol, row);
                    case TRADES -> toTrade(symbol, row);
                    case FUNDING -> toFundingRate(symbol, row);
                });
            } catch (IllegalArgumentException e) {
                malformed++;
                log.debug("Dropping malformed {} row for {}: {} ({})", dataType.id(), symbol, row, e.getMessage());
            }
        }

        if (malformed > 0) {
            log.warn("Dropped {} malformed {} rows for {}", malformed, dataType.id(), symbol);
        }

        // Stable sort keeps exchange order for equal timestamps
        records.sort(Comparator.comparingLong(MarketRecord::timestamp));
        return records;
    }

    private Candle toCandle(String symbol, JsonNode row) {
        if (!row.isArray() || row.size() < 6) {
            throw new IllegalArgumentException("expected [timestamp, open, high, low, close, volume]");
        }
        return new Candle(symbol,
            timestamp(row.get(0)),
            number(row.get(1), "open"),
            number(row.get(2), "high"),
            number(row.get(3), "low"),
            number(row.get(4), "close"),
            number(row.get(5), "volume"));
    }

    private Trade toTrade(String symbol, JsonNode row) {
        if (!row.isObject()) {
            throw new IllegalArgumentException("expected trade object");
        }
        double price = number(row.get("price"), "price");
        double amount = number(row.get("amount"), "amount");
        double cost = row.hasNonNull("cost") ? number(row.get("cost"), "cost") : price * amount;
        String side = row.path("side").asText("").toLowerCase(Locale.ROOT);
        return new Trade(symbol, timestamp(row.get("timestamp")), row.path("id").asText(""), side,
            price, amount, cost);
    }

    private FundingRate toFundingRate(String symbol, JsonNode row) {
        if (!row.isObject()) {
            throw new IllegalArgumentException("expected funding rate object");
        }
        double markPrice = row.hasNonNull("markPrice") ? number(row.get("markPrice"), "markPrice") : Double.NaN;
        return new FundingRate(symbol, timestamp(row.get("timestamp")),
            number(row.get("fundingRate"), "fundingRate"), markPrice);
    }

    private static long timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("missing timestamp");
        }
        long ts = node.isNumber() ? node.asLong() : parseLong(node.asText());
        if (ts <= 0) {
            throw new IllegalArgumentException("invalid timestamp " + ts);
        }
        return ts;
    }

    private static double number(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("missing " + field);
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("non-numeric " + field + ": " + node.asText());
        }
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("non-numeric timestamp: " + text);
        }
    }
}

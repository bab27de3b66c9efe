package com.marketvault.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketvault.core.model.DataType;
import com.marketvault.core.model.Timeframe;
import com.marketvault.core.model.Trade;
import com.marketvault.data.exception.MarketDataException;
import com.marketvault.data.exception.NetworkException;
import com.marketvault.data.exchange.MarketDataApi;
import com.marketvault.data.exchange.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory exchange generating deterministic data up to the clock's "now".
 *
 * Candles exist at every timeframe boundary, trades every {@code tradeInterval}
 * and funding rates every 8 hours. Nothing exists before {@code historyStart}.
 */
public class FakeMarketDataApi implements MarketDataApi {

    private static final long FUNDING_INTERVAL_MS = Duration.ofHours(8).toMillis();

    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<PageRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final Set<LocalDate> failingDays = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile long historyStartMillis = Long.MIN_VALUE;
    private volatile long tradeIntervalMillis = Duration.ofMinutes(1).toMillis();
    private volatile double priceShift;
    private volatile long pageDelayMillis;
    private volatile int maxPageSize = Integer.MAX_VALUE;
    private volatile Runnable onRequest;

    public FakeMarketDataApi(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Set<String> listSymbols(String exchange) {
        return new LinkedHashSet<>(List.of("BTC/USDT", "ETH/USDT"));
    }

    @Override
    public List<JsonNode> fetchPage(PageRequest request) throws MarketDataException {
        requests.add(request);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            Runnable hook = onRequest;
            if (hook != null) {
                hook.run();
            }
            if (pageDelayMillis > 0) {
                try {
                    Thread.sleep(pageDelayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NetworkException("Interrupted", e);
                }
            }
            LocalDate day = Instant.ofEpochMilli(request.since()).atZone(ZoneOffset.UTC).toLocalDate();
            if (failingDays.contains(day)) {
                throw new NetworkException("Simulated outage on " + day);
            }
            List<JsonNode> page = switch (request.dataType()) {
                case CANDLES -> candles(request);
                case TRADES -> trades(request);
                case FUNDING -> funding(request);
            };
            // Larger limits are capped, not rejected
            return page.size() > maxPageSize ? page.subList(0, maxPageSize) : page;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private List<JsonNode> candles(PageRequest request) {
        long step = Timeframe.fromId(request.subTypeId()).millis();
        List<JsonNode> page = new ArrayList<>();
        for (long t = firstAt(request.since(), step); page.size() < request.limit() && t <= nowMillis(); t += step) {
            double base = 100 + priceShift + (t / step) % 50;
            ArrayNode row = mapper.createArrayNode();
            row.add(t);
            row.add(base);
            row.add(base + 2);
            row.add(base - 1);
            row.add(base + 1);
            row.add(String.valueOf(10.5));
            page.add(row);
        }
        return page;
    }

    private List<JsonNode> trades(PageRequest request) {
        long step = tradeIntervalMillis;
        List<JsonNode> page = new ArrayList<>();
        for (long t = firstAt(request.since(), step); page.size() < request.limit() && t <= nowMillis(); t += step) {
            ObjectNode row = mapper.createObjectNode();
            row.put("id", String.valueOf(t / step));
            row.put("timestamp", t);
            row.put("side", (t / step) % 2 == 0 ? Trade.BUY : Trade.SELL);
            row.put("price", 100 + priceShift);
            row.put("amount", "0.5");
            page.add(row);
        }
        return page;
    }

    private List<JsonNode> funding(PageRequest request) {
        List<JsonNode> page = new ArrayList<>();
        for (long t = firstAt(request.since(), FUNDING_INTERVAL_MS); page.size() < request.limit() && t <= nowMillis();
             t += FUNDING_INTERVAL_MS) {
            ObjectNode row = mapper.createObjectNode();
            row.put("timestamp", t);
            row.put("fundingRate", 0.0001 + priceShift / 1_000_000);
            page.add(row);
        }
        return page;
    }

    private long firstAt(long since, long step) {
        long from = Math.max(since, historyStartMillis);
        return Math.floorDiv(from + step - 1, step) * step;
    }

    private long nowMillis() {
        return clock.instant().toEpochMilli();
    }

    public int callCount() {
        return requests.size();
    }

    public List<PageRequest> requests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    public void resetCalls() {
        requests.clear();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public void failOn(LocalDate day) {
        failingDays.add(day);
    }

    public void setHistoryStart(Instant start) {
        this.historyStartMillis = start.toEpochMilli();
    }

    public void setTradeInterval(Duration interval) {
        this.tradeIntervalMillis = interval.toMillis();
    }

    /**
     * Shift every generated price, so re-fetched records differ from stored ones.
     */
    public void setPriceShift(double shift) {
        this.priceShift = shift;
    }

    @Override
    public int maxPageSize(DataType dataType) {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public void setPageDelay(Duration delay) {
        this.pageDelayMillis = delay.toMillis();
    }

    public void setOnRequest(Runnable hook) {
        this.onRequest = hook;
    }
}

package com.marketvault.data.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketvault.core.model.DataType;
import com.marketvault.core.model.MarketRecord;
import com.marketvault.core.model.Timeframe;
import com.marketvault.data.exception.FetchException;
import com.marketvault.data.exception.MarketDataException;
import com.marketvault.data.exception.NetworkException;
import com.marketvault.data.exception.RateLimitedException;
import com.marketvault.data.exchange.MarketDataApi;
import com.marketvault.data.exchange.PageRequest;
import com.marketvault.data.normalize.RecordNormalizer;
import com.marketvault.data.plan.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches every record of one window by paging through the exchange API.
 *
 * Each page request first takes a token from the shared {@link RateLimiter}. The
 * cursor for the next page is derived from the last record received (see
 * {@link DataType#advanceCursor}). Paging stops on an empty page, a short page,
 * or once the last timestamp reaches the window end.
 *
 * Transient failures (network errors, timeouts, rate-limit rejections) are retried
 * per {@link RetryPolicy}; when retries run out the whole window fails with
 * {@link FetchException}.
 */
public class WindowFetcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WindowFetcher.class);
    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final MarketDataApi api;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration pageTimeout;
    private final int pageSize;
    private final RecordNormalizer normalizer;
    private final Sleeper sleeper;
    private final ExecutorService pageExecutor;

    public WindowFetcher(MarketDataApi api, RateLimiter rateLimiter, RetryPolicy retryPolicy, Duration pageTimeout) {
        this(api, rateLimiter, retryPolicy, pageTimeout, DEFAULT_PAGE_SIZE, new RecordNormalizer(), Sleeper.SYSTEM);
    }

    public WindowFetcher(MarketDataApi api, RateLimiter rateLimiter, RetryPolicy retryPolicy, Duration pageTimeout,
                         int pageSize, RecordNormalizer normalizer, Sleeper sleeper) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.api = api;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.pageTimeout = pageTimeout;
        this.pageSize = pageSize;
        this.normalizer = normalizer;
        this.sleeper = sleeper;

        AtomicInteger threadCount = new AtomicInteger();
        this.pageExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "page-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Fetch the whole window.
     */
    public List<MarketRecord> fetchWindow(String exchange, DataType dataType, String subTypeId, String symbol,
                                          Window window) throws FetchException, InterruptedException {
        return fetchWindow(exchange, dataType, subTypeId, symbol, window, window.startMillis());
    }

    /**
     * Fetch the window starting at {@code fromMillis} (used to resume an incomplete partition).
     *
     * @return records inside {@code [fromMillis, window end)}, ordered by timestamp
     */
    public List<MarketRecord> fetchWindow(String exchange, DataType dataType, String subTypeId, String symbol,
                                          Window window, long fromMillis) throws FetchException, InterruptedException {
        long endMillis = window.endMillis();
        long cursor = Math.max(fromMillis, window.startMillis());
        List<MarketRecord> records = new ArrayList<>();
        PageRequest request = new PageRequest(exchange, dataType, subTypeId, symbol, cursor, pageSize, pageTimeout);
        int pages = 0;

        while (cursor < endMillis) {
            int limit = pageLimit(dataType, subTypeId, cursor, endMillis);
            request = request.withSince(cursor, limit);
            List<JsonNode> raw = fetchPageWithRetry(request, symbol, window);
            pages++;

            if (raw.isEmpty()) {
                break;
            }

            List<MarketRecord> page = normalizer.normalize(dataType, symbol, raw);
            if (page.isEmpty()) {
                log.warn("Page for {} {} at {} contained no usable rows", symbol, dataType.id(), cursor);
                break;
            }
            for (MarketRecord record : page) {
                if (record.timestamp() >= cursor && record.timestamp() < endMillis) {
                    records.add(record);
                }
            }

            long last = page.get(page.size() - 1).timestamp();
            long next = dataType.advanceCursor(last, subTypeId);
            if (raw.size() < limit || last >= endMillis) {
                break;
            }
            if (next <= cursor) {
                // Exchange did not move past the cursor; stop rather than loop forever
                log.warn("Cursor for {} {} stuck at {}, stopping window {}", symbol, dataType.id(), cursor, window);
                break;
            }
            cursor = next;
        }

        log.debug("Fetched {} {} records for {} {} in {} pages", records.size(), dataType.id(), symbol, window, pages);
        return records;
    }

    /**
     * Page size capped at what the exchange serves for the data type. Candle pages
     * are also sized to the remaining window (plus one) so the last page does not
     * pull candles past the window end.
     */
    private int pageLimit(DataType dataType, String subTypeId, long cursor, long endMillis) {
        int limit = Math.min(pageSize, Math.max(1, api.maxPageSize(dataType)));
        if (dataType != DataType.CANDLES) {
            return limit;
        }
        long step = Timeframe.fromId(subTypeId).millis();
        long remaining = (endMillis - cursor) / step + 1;
        return (int) Math.max(1, Math.min(limit, remaining));
    }

    private List<JsonNode> fetchPageWithRetry(PageRequest request, String symbol, Window window)
            throws FetchException, InterruptedException {
        MarketDataException lastFailure = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            rateLimiter.acquire();
            try {
                return fetchPage(request);
            } catch (RateLimitedException | NetworkException e) {
                lastFailure = e;
            } catch (MarketDataException e) {
                throw new FetchException(symbol, window, e.getMessage(), e);
            }

            if (attempt < retryPolicy.maxAttempts()) {
                Duration delay = retryPolicy.delayAfter(attempt, lastFailure);
                log.warn("Page request for {} {} since {} failed (attempt {}/{}): {}; retrying in {} ms",
                    symbol, request.dataType().id(), request.since(), attempt, retryPolicy.maxAttempts(),
                    lastFailure.getMessage(), delay.toMillis());
                sleeper.sleepNanos(delay.toNanos());
            }
        }

        throw new FetchException(symbol, window,
            "gave up after " + retryPolicy.maxAttempts() + " attempts", lastFailure);
    }

    /**
     * One page call bounded by the page timeout. A timeout is reported as a
     * retryable {@link NetworkException}.
     */
    private List<JsonNode> fetchPage(PageRequest request) throws MarketDataException, InterruptedException {
        if (pageTimeout == null || pageTimeout.isZero()) {
            return api.fetchPage(request);
        }

        Future<List<JsonNode>> future = pageExecutor.submit(() -> api.fetchPage(request));
        try {
            return future.get(pageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new NetworkException("Page request timed out after " + pageTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MarketDataException mde) {
                throw mde;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new MarketDataException("Page request failed", cause);
        }
    }

    @Override
    public void close() {
        pageExecutor.shutdownNow();
    }
}

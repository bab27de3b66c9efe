package com.marketvault.data;

import com.marketvault.core.model.DataType;
import com.marketvault.core.model.MarketRecord;
import com.marketvault.core.model.PartitionSpan;
import com.marketvault.data.config.DownloaderConfig;
import com.marketvault.data.download.DownloadRequest;
import com.marketvault.data.download.DownloadSummary;
import com.marketvault.data.download.FetchOrchestrator;
import com.marketvault.data.download.PartitionLocks;
import com.marketvault.data.exception.MarketDataException;
import com.marketvault.data.exchange.BinanceMarketDataClient;
import com.marketvault.data.exchange.MarketDataApi;
import com.marketvault.data.fetch.RateLimiter;
import com.marketvault.data.fetch.RetryPolicy;
import com.marketvault.data.fetch.WindowFetcher;
import com.marketvault.data.normalize.RecordDeduplicator;
import com.marketvault.data.plan.WindowPlanner;
import com.marketvault.data.store.ColumnarPartitionStore;
import com.marketvault.data.store.PartitionId;
import com.marketvault.data.store.PartitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for downloading and loading cached market data.
 *
 * <pre>
 * try (MarketVault vault = new MarketVault()) {
 *     vault.download("binanceusdm", List.of(DataType.CANDLES, DataType.FUNDING), List.of("BTC/USDT:USDT"),
 *         LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1),
 *         DownloadOptions.defaults().withSubTypes(DataType.CANDLES, "1m", "1h"));
 *     List&lt;MarketRecord&gt; candles = vault.loadData("binanceusdm", DataType.CANDLES, "1h",
 *         List.of("BTC/USDT:USDT"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1));
 * }
 * </pre>
 */
public class MarketVault implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketVault.class);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final DownloaderConfig config;
    private final MarketDataApi api;
    private final Clock clock;
    private final PartitionStore store;
    private final WindowPlanner planner;
    private final RetryPolicy retryPolicy;
    private final PartitionLocks locks = new PartitionLocks();
    private final WindowFetcher fetcher;
    private final FetchOrchestrator orchestrator;

    public MarketVault() {
        this(DownloaderConfig.load(), new BinanceMarketDataClient());
    }

    public MarketVault(DownloaderConfig config, MarketDataApi api) {
        this(config, api, Clock.systemUTC());
    }

    public MarketVault(DownloaderConfig config, MarketDataApi api, Clock clock) {
        this(config, api, clock, new ColumnarPartitionStore(config.getDataDir()));
    }

    public MarketVault(DownloaderConfig config, MarketDataApi api, Clock clock, PartitionStore store) {
        this.config = config;
        this.api = api;
        this.clock = clock;
        this.store = store;
        this.planner = new WindowPlanner(clock);
        this.retryPolicy = new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoff(), MAX_BACKOFF);
        this.fetcher = new WindowFetcher(api, RateLimiter.tokenBucket(config.getRatePermits(), config.getRatePeriod()),
            retryPolicy, config.getPageTimeout());
        this.orchestrator = newOrchestrator(fetcher, config.getMaxConcurrentDownloads());
        log.debug("MarketVault using data dir {}", config.getDataDir());
    }

    /**
     * Download every (data type x sub-type x symbol) combination for {@code [startDate, endDate)}.
     * Partitions already complete on disk are not fetched again.
     *
     * @return one summary per data type, in the order given
     */
    public List<DownloadSummary> download(String exchange, List<DataType> dataTypes, List<String> symbols,
                                          LocalDate startDate, LocalDate endDate, DownloadOptions options)
            throws InterruptedException {
        DownloadOptions opts = options != null ? options : DownloadOptions.defaults();
        AtomicBoolean cancelled = opts.cancelled() != null ? opts.cancelled() : new AtomicBoolean(false);
        Set<String> symbolSet = new LinkedHashSet<>(symbols);

        List<DownloadRequest> requests = new ArrayList<>();
        for (DataType dataType : dataTypes) {
            requests.add(new DownloadRequest(exchange, dataType, opts.subTypesFor(dataType), symbolSet,
                startDate, endDate));
        }

        if (!opts.overridesWorkers()) {
            return run(orchestrator, requests, cancelled);
        }

        RateLimiter limiter = opts.rateLimiter() != null
            ? opts.rateLimiter()
            : RateLimiter.tokenBucket(config.getRatePermits(), config.getRatePeriod());
        int parallelism = opts.parallelism() != null ? opts.parallelism() : config.getMaxConcurrentDownloads();
        try (WindowFetcher customFetcher = new WindowFetcher(api, limiter, retryPolicy, config.getPageTimeout());
             FetchOrchestrator customOrchestrator = newOrchestrator(customFetcher, parallelism)) {
            return run(customOrchestrator, requests, cancelled);
        }
    }

    private static List<DownloadSummary> run(FetchOrchestrator orchestrator, List<DownloadRequest> requests,
                                             AtomicBoolean cancelled) throws InterruptedException {
        List<DownloadSummary> summaries = new ArrayList<>();
        for (DownloadRequest request : requests) {
            summaries.add(orchestrator.download(request, cancelled));
        }
        return summaries;
    }

    /**
     * Load stored records for {@code [startDate, endDate)}, sorted by timestamp then symbol.
     * Only data already on disk is returned; nothing is fetched.
     *
     * @param symbols   symbols to load, or null for every stored symbol
     * @param startDate first day (inclusive), or null for no lower bound
     * @param endDate   last day (exclusive), or null for no upper bound
     */
    public List<MarketRecord> loadData(String exchange, DataType dataType, String subTypeId,
                                       Collection<String> symbols, LocalDate startDate, LocalDate endDate)
            throws IOException {
        String subType = dataType.resolveSubType(subTypeId);
        PartitionSpan span = dataType.partitionSpan(subType);
        Collection<String> wanted = symbols != null ? symbols : store.listSymbols(exchange, dataType, subType);

        long fromMs = startDate != null ? startDate.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli()
            : Long.MIN_VALUE;
        long toMs = endDate != null ? endDate.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli()
            : Long.MAX_VALUE;

        List<MarketRecord> records = new ArrayList<>();
        for (String symbol : new LinkedHashSet<>(wanted)) {
            for (LocalDate key : store.listPartitionKeys(exchange, dataType, subType, symbol)) {
                Instant partitionStart = span.start(key);
                Instant partitionEnd = span.end(key);
                if (partitionEnd.toEpochMilli() <= fromMs || partitionStart.toEpochMilli() >= toMs) {
                    continue;
                }
                PartitionId id = new PartitionId(exchange, dataType, subType, symbol, key);
                try {
                    for (MarketRecord record : store.read(id).records()) {
                        if (record.timestamp() >= fromMs && record.timestamp() < toMs) {
                            records.add(record);
                        }
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable partition {}: {}", id, e.getMessage());
                }
            }
        }
        return RecordDeduplicator.dedup(records);
    }

    /**
     * Symbols the exchange currently lists.
     */
    public Set<String> listSymbols(String exchange) throws MarketDataException {
        return api.listSymbols(exchange);
    }

    private FetchOrchestrator newOrchestrator(WindowFetcher windowFetcher, int parallelism) {
        return new FetchOrchestrator(planner, store, windowFetcher, clock, config.getCompletenessMargin(),
            parallelism, locks);
    }

    @Override
    public void close() {
        orchestrator.close();
        fetcher.close();
    }
}

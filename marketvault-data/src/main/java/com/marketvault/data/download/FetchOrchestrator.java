package com.marketvault.data.download;

import com.marketvault.core.model.DataType;
import com.marketvault.core.model.MarketRecord;
import com.marketvault.data.exception.FetchException;
import com.marketvault.data.fetch.WindowFetcher;
import com.marketvault.data.normalize.RecordDeduplicator;
import com.marketvault.data.plan.Window;
import com.marketvault.data.plan.WindowPlanner;
import com.marketvault.data.store.PartitionId;
import com.marketvault.data.store.PartitionStatus;
import com.marketvault.data.store.PartitionStore;
import com.marketvault.data.store.StoredPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads a batch of (symbol x sub-type) windows into the partition store.
 *
 * Complete partitions are skipped. Absent ones are fetched from the window start;
 * incomplete ones resume from their last stored record and are merged with what
 * is already on disk. Windows run on a bounded pool; a per-partition lock keeps
 * fetch-then-commit for one partition single-threaded. A failing window is
 * recorded in the summary and does not stop the rest of the batch.
 */
public class FetchOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final WindowPlanner planner;
    private final PartitionStore store;
    private final WindowFetcher fetcher;
    private final Clock clock;
    private final Duration completenessMargin;
    private final ExecutorService pool;
    private final PartitionLocks locks;

    public FetchOrchestrator(WindowPlanner planner, PartitionStore store, WindowFetcher fetcher, Clock clock,
                             Duration completenessMargin, int parallelism) {
        this(planner, store, fetcher, clock, completenessMargin, parallelism, new PartitionLocks());
    }

    /**
     * Orchestrators writing to the same store must share {@code locks}.
     */
    public FetchOrchestrator(WindowPlanner planner, PartitionStore store, WindowFetcher fetcher, Clock clock,
                             Duration completenessMargin, int parallelism, PartitionLocks locks) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.planner = planner;
        this.store = store;
        this.fetcher = fetcher;
        this.clock = clock;
        this.completenessMargin = completenessMargin;
        this.locks = locks;

        AtomicInteger threadCount = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "window-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public DownloadSummary download(DownloadRequest request) throws InterruptedException {
        return download(request, new AtomicBoolean(false));
    }

    /**
     * Run a download. Setting {@code cancelled} stops dispatching new windows;
     * windows already fetching run to their commit.
     */
    public DownloadSummary download(DownloadRequest request, AtomicBoolean cancelled) throws InterruptedException {
        DataType dataType = request.dataType();
        List<Slot> slots = new ArrayList<>();

        for (String subTypeId : request.subTypeIds()) {
            List<Window> windows = planner.planPartitions(dataType, subTypeId, request.startDate(), request.endDate());
            log.debug("Planned {} windows for {} {} {}..{}", windows.size(), dataType.id(), subTypeId,
                request.startDate(), request.endDate());

            for (String symbol : request.symbols()) {
                for (Window window : windows) {
                    slots.add(dispatch(request.exchange(), dataType, subTypeId, symbol, window, cancelled));
                }
            }
        }

        List<WindowResult> results = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            results.add(slot.await());
        }

        DownloadSummary summary = new DownloadSummary(request.exchange(), dataType, request.startDate(),
            request.endDate(), results);
        log.info("Download finished: {}", summary);
        return summary;
    }

    private Slot dispatch(String exchange, DataType dataType, String subTypeId, String symbol, Window window,
                          AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return Slot.done(WindowResult.cancelled(symbol, subTypeId, window));
        }
        PartitionId id = new PartitionId(exchange, dataType, subTypeId, symbol, window.partitionKey());
        try {
            // COMPLETE is terminal, so it can be skipped without taking the partition lock
            if (store.status(id) == PartitionStatus.COMPLETE_PRESENT) {
                log.debug("Skipping complete partition {}", id);
                return Slot.done(WindowResult.skipped(symbol, subTypeId, window));
            }
        } catch (IOException e) {
            log.warn("Could not check status of {}: {}", id, e.getMessage());
        }
        try {
            Future<WindowResult> future = pool.submit(() -> processWindow(id, window, cancelled));
            return new Slot(symbol, subTypeId, window, null, future);
        } catch (RejectedExecutionException e) {
            log.debug("Orchestrator closed, not dispatching {}", id);
            return Slot.done(WindowResult.cancelled(symbol, subTypeId, window));
        }
    }

    /**
     * Fetch, merge and commit one window while holding its partition lock.
     */
    WindowResult processWindow(PartitionId id, Window window, AtomicBoolean cancelled) {
        String symbol = id.symbol();
        String subTypeId = id.subTypeId();
        try {
            locks.lockInterruptibly(id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WindowResult.cancelled(symbol, subTypeId, window);
        }

        try {
            if (cancelled.get()) {
                return WindowResult.cancelled(symbol, subTypeId, window);
            }

            PartitionState initial;
            try {
                initial = PartitionState.of(store.status(id));
            } catch (IOException e) {
                log.warn("Could not check status of {}: {}", id, e.getMessage());
                return WindowResult.failed(symbol, subTypeId, window, "Status check failed: " + e.getMessage());
            }
            if (!initial.needsFetch()) {
                return WindowResult.skipped(symbol, subTypeId, window);
            }

            PartitionState state = initial.transitionTo(PartitionState.FETCHING);
            List<MarketRecord> existing = List.of();
            long from = window.startMillis();

            if (initial == PartitionState.INCOMPLETE) {
                try {
                    StoredPartition stored = store.read(id);
                    existing = stored.records();
                    // Resume at the last stored record so a still-forming record is refreshed
                    if (stored.lastTimestamp() >= window.startMillis()) {
                        from = stored.lastTimestamp();
                    }
                } catch (IOException e) {
                    log.warn("Could not read incomplete partition {}, fetching it from scratch: {}", id,
                        e.getMessage());
                }
            }

            try {
                List<MarketRecord> incoming = fetcher.fetchWindow(id.exchange(), id.dataType(), subTypeId, symbol,
                    window, from);
                List<MarketRecord> merged = RecordDeduplicator.dedup(existing, incoming);
                boolean complete = isComplete(window, clock.instant());

                if (merged.isEmpty() && complete) {
                    state.transitionTo(initial);
                    log.warn("No {} data for {} in past window {}, not caching an empty partition",
                        id.dataType().id(), symbol, window);
                    return WindowResult.outOfRange(symbol, subTypeId, window);
                }

                store.write(id, merged, complete);
                state.transitionTo(complete ? PartitionState.COMPLETE : PartitionState.INCOMPLETE);
                log.info("Fetched {}: {} records ({} from exchange), {}", id, merged.size(), incoming.size(),
                    complete ? "complete" : "incomplete");
                return WindowResult.fetched(symbol, subTypeId, window, merged.size(), complete);
            } catch (FetchException e) {
                state.transitionTo(initial);
                log.warn(e.getMessage());
                return WindowResult.failed(symbol, subTypeId, window, e.getMessage());
            } catch (IOException e) {
                state.transitionTo(initial);
                log.warn("Failed to write partition {}: {}", id, e.getMessage());
                return WindowResult.failed(symbol, subTypeId, window, "Store write failed: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.transitionTo(initial);
                return WindowResult.cancelled(symbol, subTypeId, window);
            }
        } finally {
            locks.unlock(id);
        }
    }

    /**
     * A window is complete when it spans its whole partition and the partition
     * ended at least {@code completenessMargin} before {@code now}.
     */
    boolean isComplete(Window window, Instant now) {
        return window.coversPartition() && window.partitionEnd().plus(completenessMargin).isBefore(now);
    }

    /**
     * Stop the pool. Running windows are interrupted; queued ones report CANCELLED.
     */
    @Override
    public void close() {
        for (Runnable queued : pool.shutdownNow()) {
            if (queued instanceof Future<?> future) {
                future.cancel(false);
            }
        }
    }

    /**
     * Placeholder for a window result, either known at dispatch or pending on the pool.
     */
    private record Slot(String symbol, String subTypeId, Window window, WindowResult result,
                        Future<WindowResult> future) {

        static Slot done(WindowResult result) {
            return new Slot(result.symbol(), result.subTypeId(), null, result, null);
        }

        WindowResult await() throws InterruptedException {
            if (result != null) {
                return result;
            }
            try {
                return future.get();
            } catch (CancellationException e) {
                return WindowResult.cancelled(symbol, subTypeId, window);
            } catch (ExecutionException e) {
                log.error("Unexpected failure fetching {} {}", symbol, window, e.getCause());
                return WindowResult.failed(symbol, subTypeId, window, String.valueOf(e.getCause()));
            }
        }
    }
}

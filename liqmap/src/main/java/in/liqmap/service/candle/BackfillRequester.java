package in.liqmap.service.candle;

import in.liqmap.application.port.output.CandleHistorySource;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.sync.GapRange;
import in.liqmap.infrastructure.metrics.ZoneMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Backfill Requester - Fetches missing candles for gaps reported by CandleSync.
 *
 * Each request runs on its own executor so live ingestion never waits on it. The fetch starts at
 * the first missing open timestamp (last known-good + interval) and asks for exactly the missing
 * count, split into pages of {@link #MAX_PAGE_SIZE}. Failures are logged and counted; retries are
 * the history source's concern.
 */
public final class BackfillRequester implements BackfillTrigger {
    private static final Logger log = LoggerFactory.getLogger(BackfillRequester.class);

    /** Largest page requested from the history source in one call. */
    public static final int MAX_PAGE_SIZE = 1000;

    private final CandleHistorySource historySource;
    private final ExecutorService executor;
    private final ZoneMetrics metrics;
    private final List<BackfillListener> listeners = new CopyOnWriteArrayList<>();

    public BackfillRequester(CandleHistorySource historySource, int threads, ZoneMetrics metrics) {
        this(historySource, Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "liqmap-backfill");
            t.setDaemon(true);
            return t;
        }), metrics);
    }

    public BackfillRequester(CandleHistorySource historySource, ExecutorService executor, ZoneMetrics metrics) {
        this.historySource = historySource;
        this.executor = executor;
        this.metrics = metrics;
    }

    public void addListener(BackfillListener listener) {
        listeners.add(listener);
    }

    @Override
    public void requestBackfill(String symbol, Timeframe timeframe, GapRange gap) {
        backfill(symbol, timeframe, gap);
    }

    /**
     * Fetch the gap asynchronously.
     *
     * @return future with the recovered candles inside the gap; completes with an empty list on failure
     * @throws IllegalStateException if the requester has been shut down
     */
    public CompletableFuture<List<Candle>> backfill(String symbol, Timeframe timeframe, GapRange gap) {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Backfill requester is shut down");
        }
        log.info("[BACKFILL] Requesting {} {} from {} ({} candle(s))",
            symbol, timeframe, gap.startTs(), gap.missingCount());
        return CompletableFuture.supplyAsync(() -> fetchGap(symbol, timeframe, gap), executor);
    }

    private List<Candle> fetchGap(String symbol, Timeframe timeframe, GapRange gap) {
        long started = System.nanoTime();
        try {
            List<Candle> recovered = fetchPages(symbol, timeframe, gap);
            Duration latency = Duration.ofNanos(System.nanoTime() - started);

            if (recovered.size() < gap.missingCount()) {
                log.warn("[BACKFILL] {} {} recovered {}/{} candle(s) for [{}, {}]",
                    symbol, timeframe, recovered.size(), gap.missingCount(), gap.startTs(), gap.endTs());
            } else {
                log.info("[BACKFILL] {} {} recovered {} candle(s) for [{}, {}] in {}ms",
                    symbol, timeframe, recovered.size(), gap.startTs(), gap.endTs(), latency.toMillis());
            }
            if (metrics != null) {
                metrics.recordBackfill(symbol, timeframe, true, recovered.size(), latency);
            }

            if (!recovered.isEmpty()) {
                notifyListeners(symbol, timeframe, gap, recovered);
            }
            return recovered;

        } catch (Exception e) {
            log.warn("[BACKFILL] Failed to backfill {} {} from {}: {}",
                symbol, timeframe, gap.startTs(), e.getMessage(), e);
            if (metrics != null) {
                metrics.recordBackfill(symbol, timeframe, false, 0, Duration.ofNanos(System.nanoTime() - started));
            }
            return List.of();
        }
    }

    private List<Candle> fetchPages(String symbol, Timeframe timeframe, GapRange gap) {
        Map<Long, Candle> byOpenTs = new TreeMap<>();
        long start = gap.startTs();
        long remaining = gap.missingCount();

        while (remaining > 0) {
            int limit = (int) Math.min(remaining, MAX_PAGE_SIZE);
            List<Candle> page = historySource.fetchCandles(symbol, timeframe, start, limit);
            if (page == null || page.isEmpty()) {
                break;
            }
            for (Candle c : page) {
                if (gap.contains(c.openTs())) {
                    byOpenTs.put(c.openTs(), c);
                }
            }
            start += (long) limit * gap.intervalSeconds();
            remaining -= limit;
        }
        return new ArrayList<>(byOpenTs.values());
    }

    private void notifyListeners(String symbol, Timeframe timeframe, GapRange gap, List<Candle> recovered) {
        List<Candle> view = List.copyOf(recovered);
        for (BackfillListener listener : listeners) {
            try {
                listener.onBackfill(symbol, timeframe, gap, view);
            } catch (Exception e) {
                log.error("[BACKFILL] Listener failed for {} {}: {}", symbol, timeframe, e.getMessage(), e);
            }
        }
    }

    /**
     * Stop accepting requests and wait briefly for in-flight fetches.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[BACKFILL] In-flight backfills did not finish, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

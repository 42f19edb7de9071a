package in.liqmap.service.candle;

import in.liqmap.application.port.output.CandleHistorySource;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.sync.SyncResult;
import in.liqmap.domain.sync.SyncStatus;
import in.liqmap.infrastructure.metrics.ZoneMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one CandleSync per symbol/timeframe.
 *
 * Each pair is seeded exactly once from the latest persisted candle when it is first registered,
 * either through {@link #start(Collection, Collection)} or lazily on its first live candle.
 */
public final class CandleSyncManager {
    private static final Logger log = LoggerFactory.getLogger(CandleSyncManager.class);

    private final CandleHistorySource historySource;
    private final BackfillTrigger backfillTrigger;
    private final ZoneMetrics metrics;

    private final Map<SyncKey, CandleSync> syncs = new ConcurrentHashMap<>();

    public CandleSyncManager(CandleHistorySource historySource, BackfillTrigger backfillTrigger, ZoneMetrics metrics) {
        this.historySource = historySource;
        this.backfillTrigger = backfillTrigger;
        this.metrics = metrics;
    }

    /**
     * Register and seed every symbol/timeframe pair.
     */
    public void start(Collection<String> symbols, Collection<Timeframe> timeframes) {
        log.info("[SYNC] Seeding {} symbol(s) x {} timeframe(s)", symbols.size(), timeframes.size());
        for (String symbol : symbols) {
            for (Timeframe tf : timeframes) {
                getOrCreate(symbol, tf);
            }
        }
    }

    /**
     * Route a closed candle to its pair's sync.
     */
    public SyncResult onClosedCandle(String symbol, Timeframe timeframe, Candle candle) {
        SyncResult result = getOrCreate(symbol, timeframe).onClosedCandle(candle);

        if (metrics != null) {
            if (result.status() == SyncStatus.GAP_DETECTED) {
                metrics.recordGap(symbol, timeframe, result.gap().missingCount());
            } else if (result.status() == SyncStatus.REJECTED_STALE) {
                metrics.recordRejectedCandle(symbol, timeframe, "stale");
            } else if (result.status() == SyncStatus.REJECTED_INVALID) {
                metrics.recordRejectedCandle(symbol, timeframe, "invalid");
            }
        }
        return result;
    }

    public Optional<CandleSync> get(String symbol, Timeframe timeframe) {
        return Optional.ofNullable(syncs.get(new SyncKey(symbol, timeframe)));
    }

    public int size() {
        return syncs.size();
    }

    private CandleSync getOrCreate(String symbol, Timeframe timeframe) {
        return syncs.computeIfAbsent(new SyncKey(symbol, timeframe), key -> {
            CandleSync sync = new CandleSync(symbol, timeframe, backfillTrigger);
            seedFromHistory(sync);
            return sync;
        });
    }

    private void seedFromHistory(CandleSync sync) {
        String symbol = sync.getSymbol();
        Timeframe tf = sync.getTimeframe();
        try {
            Optional<Candle> last = historySource.getLastCandle(symbol, tf);
            if (last.isPresent()) {
                sync.seed(last.get().openTs());
            } else {
                log.info("[SYNC] {} {} has no persisted candles, first live candle will bootstrap", symbol, tf);
            }
        } catch (Exception e) {
            log.error("[SYNC] Failed to load last candle for {} {}, starting unseeded: {}",
                symbol, tf, e.getMessage(), e);
        }
    }

    private record SyncKey(String symbol, Timeframe timeframe) {}
}

package in.liqmap.service.symbol;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendState;
import in.liqmap.domain.sync.GapRange;
import in.liqmap.domain.sync.SyncResult;
import in.liqmap.domain.sync.SyncStatus;
import in.liqmap.service.candle.BackfillListener;
import in.liqmap.service.candle.CandleSyncManager;
import in.liqmap.service.candle.CandleWindow;
import in.liqmap.service.zone.LiquidityMap;
import in.liqmap.service.zone.RefreshResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-symbol wiring: candle sync, one candle window per timeframe, and the liquidity map.
 *
 * Every accepted closed candle (in sequence, duplicate revision, or first candle after a gap)
 * goes into its timeframe's window. Refreshes only ever see the window's newest gap-free run:
 * the candle that opens a gap is stored without a refresh, and the backfilled candles are
 * spliced in order before the next one.
 */
public final class SymbolPipeline implements BackfillListener {
    private static final Logger log = LoggerFactory.getLogger(SymbolPipeline.class);

    private final String symbol;
    private final CandleSyncManager syncManager;
    private final LiquidityMap liquidityMap;
    private final Supplier<TrendState> trendSupplier;
    private final Map<Timeframe, CandleWindow> windows = new EnumMap<>(Timeframe.class);

    public SymbolPipeline(String symbol, CandleSyncManager syncManager, LiquidityMap liquidityMap,
                          int windowSize, Supplier<TrendState> trendSupplier) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.syncManager = Objects.requireNonNull(syncManager, "syncManager");
        this.liquidityMap = Objects.requireNonNull(liquidityMap, "liquidityMap");
        if (!symbol.equals(liquidityMap.getSymbol())) {
            throw new IllegalArgumentException(
                "Liquidity map is for " + liquidityMap.getSymbol() + ", pipeline for " + symbol);
        }
        this.trendSupplier = trendSupplier != null ? trendSupplier : () -> null;
        for (Timeframe tf : liquidityMap.getTimeframes()) {
            windows.put(tf, new CandleWindow(windowSize));
        }
    }

    public SymbolPipeline(String symbol, CandleSyncManager syncManager, LiquidityMap liquidityMap, int windowSize) {
        this(symbol, syncManager, liquidityMap, windowSize, null);
    }

    /**
     * Feed one closed candle of this symbol.
     */
    public SyncResult onClosedCandle(Timeframe timeframe, Candle candle) {
        CandleWindow window = window(timeframe);
        SyncResult result = syncManager.onClosedCandle(symbol, timeframe, candle);
        if (!result.isAccepted()) {
            return result;
        }

        window.add(candle);
        if (result.status() == SyncStatus.GAP_DETECTED) {
            log.debug("[LIQMAP] {} {} refresh deferred until [{}, {}] is backfilled",
                symbol, timeframe, result.gap().startTs(), result.gap().endTs());
            return result;
        }
        refresh(timeframe, window, candle.close());
        return result;
    }

    @Override
    public void onBackfill(String symbol, Timeframe timeframe, GapRange gap, List<Candle> recovered) {
        if (!this.symbol.equals(symbol) || !windows.containsKey(timeframe) || recovered.isEmpty()) {
            return;
        }
        CandleWindow window = windows.get(timeframe);
        window.addAll(recovered);
        log.info("[BACKFILL] {} {} spliced {}/{} candle(s) into window",
            symbol, timeframe, recovered.size(), gap.missingCount());

        Candle latest = window.latest();
        if (latest != null) {
            refresh(timeframe, window, latest.close());
        }
    }

    private void refresh(Timeframe timeframe, CandleWindow window, double price) {
        TrendState trend = null;
        try {
            trend = trendSupplier.get();
        } catch (RuntimeException e) {
            log.warn("[LIQMAP] {} trend supplier failed, refreshing without trend: {}", symbol, e.getMessage(), e);
        }
        RefreshResult result = liquidityMap.onCandleClose(timeframe, window.contiguousTail(), price, trend);
        if (!result.detectionRan()) {
            log.debug("[LIQMAP] {} {} refresh: {}", symbol, timeframe, result.skipReason());
        }
    }

    private CandleWindow window(Timeframe timeframe) {
        CandleWindow window = windows.get(timeframe);
        if (window == null) {
            throw new IllegalArgumentException("Timeframe " + timeframe + " not tracked for " + symbol);
        }
        return window;
    }

    public String getSymbol() {
        return symbol;
    }

    public LiquidityMap getLiquidityMap() {
        return liquidityMap;
    }

    /**
     * Current window contents for one timeframe, oldest first.
     */
    public List<Candle> getCandles(Timeframe timeframe) {
        return window(timeframe).snapshot();
    }
}

package in.liqmap.bootstrap;

import in.liqmap.application.port.output.CandleHistorySource;
import in.liqmap.config.TimeframeConfigService;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendState;
import in.liqmap.domain.sync.SyncResult;
import in.liqmap.infrastructure.metrics.PrometheusZoneMetrics;
import in.liqmap.infrastructure.metrics.StatsServer;
import in.liqmap.service.candle.BackfillRequester;
import in.liqmap.service.candle.CandleSyncManager;
import in.liqmap.service.symbol.SymbolPipeline;
import in.liqmap.service.zone.LiquidityMap;
import in.liqmap.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wires config, metrics, candle sync, backfill, liquidity maps and the stats server.
 *
 * <pre>
 * LiquidityEngine engine = LiquidityEngine.fromEnv(historySource, List.of("BTCUSDT"), null);
 * engine.start();
 * engine.onClosedCandle("BTCUSDT", Timeframe.M5, candle);
 * </pre>
 */
public final class LiquidityEngine {
    private static final Logger log = LoggerFactory.getLogger(LiquidityEngine.class);

    /**
     * Engine settings; {@link #fromEnv()} reads them from the environment.
     *
     * @param statsPort stats server port, ignored when statsEnabled is false
     */
    public record Settings(String configDir, int backfillThreads, int windowSize, boolean statsEnabled, int statsPort) {
        public static Settings fromEnv() {
            return new Settings(Env.configDir(), Env.backfillThreads(), Env.windowSize(),
                Env.statsEnabled(), Env.statsPort());
        }
    }

    private final Set<Timeframe> timeframes;
    private final PrometheusZoneMetrics metrics;
    private final BackfillRequester backfill;
    private final CandleSyncManager syncManager;
    private final Map<String, SymbolPipeline> pipelines = new LinkedHashMap<>();
    private final StatsServer statsServer;

    public LiquidityEngine(Settings settings, CandleHistorySource historySource, PrometheusZoneMetrics metrics,
                           Collection<String> symbols, Set<Timeframe> timeframes,
                           Function<String, Supplier<TrendState>> trendBySymbol) {
        this.timeframes = EnumSet.copyOf(timeframes);
        this.metrics = metrics;
        TimeframeConfigService configService = new TimeframeConfigService(settings.configDir());

        this.backfill = new BackfillRequester(historySource, settings.backfillThreads(), metrics);
        this.syncManager = new CandleSyncManager(historySource, backfill, metrics);

        List<LiquidityMap> maps = new ArrayList<>();
        for (String symbol : symbols) {
            LiquidityMap map = new LiquidityMap(symbol, configService, this.timeframes, metrics);
            Supplier<TrendState> trend = trendBySymbol != null ? trendBySymbol.apply(symbol) : null;
            SymbolPipeline pipeline = new SymbolPipeline(symbol, syncManager, map, settings.windowSize(), trend);
            backfill.addListener(pipeline);
            pipelines.put(symbol, pipeline);
            maps.add(map);
        }

        this.statsServer = settings.statsEnabled()
            ? new StatsServer(settings.statsPort(), metrics.getRegistry(), maps)
            : null;
    }

    /**
     * Engine on the default Prometheus registry, all timeframes, settings from the environment.
     */
    public static LiquidityEngine fromEnv(CandleHistorySource historySource, Collection<String> symbols,
                                          Function<String, Supplier<TrendState>> trendBySymbol) {
        return new LiquidityEngine(Settings.fromEnv(), historySource, new PrometheusZoneMetrics(),
            symbols, EnumSet.allOf(Timeframe.class), trendBySymbol);
    }

    /**
     * Seed every symbol/timeframe from history and start the stats server.
     */
    public void start() {
        syncManager.start(pipelines.keySet(), timeframes);
        if (statsServer != null) {
            statsServer.start();
        }
        log.info("[ENGINE] Started {} symbol(s) on {}", pipelines.size(), timeframes);
    }

    public void stop() {
        if (statsServer != null) {
            statsServer.stop();
        }
        backfill.shutdown();
        log.info("[ENGINE] Stopped");
    }

    public SyncResult onClosedCandle(String symbol, Timeframe timeframe, Candle candle) {
        SymbolPipeline pipeline = pipelines.get(symbol);
        if (pipeline == null) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return pipeline.onClosedCandle(timeframe, candle);
    }

    public Optional<LiquidityMap> getLiquidityMap(String symbol) {
        SymbolPipeline pipeline = pipelines.get(symbol);
        return pipeline == null ? Optional.empty() : Optional.of(pipeline.getLiquidityMap());
    }

    public Optional<SymbolPipeline> getPipeline(String symbol) {
        return Optional.ofNullable(pipelines.get(symbol));
    }

    public PrometheusZoneMetrics getMetrics() {
        return metrics;
    }

    public CandleSyncManager getSyncManager() {
        return syncManager;
    }
}

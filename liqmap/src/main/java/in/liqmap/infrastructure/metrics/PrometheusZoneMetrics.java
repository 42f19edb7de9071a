package in.liqmap.infrastructure.metrics;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.FilterStage;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of ZoneMetrics.
 *
 * Key Metrics:
 * - liqmap_zone_filtered_total{symbol, timeframe, stage} - Zones/refreshes dropped per filter stage
 * - liqmap_zones_created_total{symbol, timeframe} - Zones created
 * - liqmap_active_zones{symbol, timeframe} - Current zone-set size
 * - liqmap_gaps_detected_total{symbol, timeframe} - Sequence gaps seen by candle sync
 * - liqmap_missing_candles_total{symbol, timeframe} - Intervals missing across all gaps
 * - liqmap_rejected_candles_total{symbol, timeframe, reason} - Stale/invalid candles dropped
 * - liqmap_backfill_total{symbol, timeframe, outcome} - Backfill requests by outcome
 * - liqmap_backfill_latency_seconds{timeframe} - Backfill fetch latency
 *
 * Usage:
 * <pre>
 * PrometheusZoneMetrics metrics = new PrometheusZoneMetrics();
 * LiquidityMap map = new LiquidityMap("BTCUSDT", configService, metrics);
 *
 * // Expose at /metrics endpoint
 * new StatsServer(port, metrics.getRegistry(), List.of(map)).start();
 * </pre>
 */
public class PrometheusZoneMetrics implements ZoneMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusZoneMetrics.class);

    private final CollectorRegistry registry;

    // Zone refresh metrics
    private final Counter filteredCounter;
    private final Counter createdCounter;
    private final Gauge activeZones;

    // Sync metrics
    private final Counter gapCounter;
    private final Counter missingCandlesCounter;
    private final Counter rejectedCounter;

    // Backfill metrics
    private final Counter backfillCounter;
    private final Histogram backfillLatency;

    public PrometheusZoneMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusZoneMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.filteredCounter = Counter.build()
            .name("liqmap_zone_filtered_total")
            .help("Zones or refreshes dropped by a filter stage")
            .labelNames("symbol", "timeframe", "stage")
            .register(registry);

        this.createdCounter = Counter.build()
            .name("liqmap_zones_created_total")
            .help("Total number of zones created")
            .labelNames("symbol", "timeframe")
            .register(registry);

        this.activeZones = Gauge.build()
            .name("liqmap_active_zones")
            .help("Current number of zones held per timeframe")
            .labelNames("symbol", "timeframe")
            .register(registry);

        this.gapCounter = Counter.build()
            .name("liqmap_gaps_detected_total")
            .help("Total number of candle sequence gaps detected")
            .labelNames("symbol", "timeframe")
            .register(registry);

        this.missingCandlesCounter = Counter.build()
            .name("liqmap_missing_candles_total")
            .help("Total number of missing candle intervals across all gaps")
            .labelNames("symbol", "timeframe")
            .register(registry);

        this.rejectedCounter = Counter.build()
            .name("liqmap_rejected_candles_total")
            .help("Total number of stale or invalid candles rejected")
            .labelNames("symbol", "timeframe", "reason")
            .register(registry);

        this.backfillCounter = Counter.build()
            .name("liqmap_backfill_total")
            .help("Total number of backfill requests by outcome")
            .labelNames("symbol", "timeframe", "outcome")
            .register(registry);

        this.backfillLatency = Histogram.build()
            .name("liqmap_backfill_latency_seconds")
            .help("Backfill fetch latency in seconds")
            .labelNames("timeframe")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        log.info("Prometheus zone metrics initialized");
    }

    @Override
    public void recordFiltered(String symbol, Timeframe timeframe, FilterStage stage, int count) {
        if (count <= 0) {
            return;
        }
        filteredCounter.labels(symbol, timeframe.getLabel(), stage.label()).inc(count);
    }

    @Override
    public void recordZonesCreated(String symbol, Timeframe timeframe, int count) {
        if (count <= 0) {
            return;
        }
        createdCounter.labels(symbol, timeframe.getLabel()).inc(count);
    }

    @Override
    public void setActiveZones(String symbol, Timeframe timeframe, int count) {
        activeZones.labels(symbol, timeframe.getLabel()).set(count);
    }

    @Override
    public void recordGap(String symbol, Timeframe timeframe, long missingCandles) {
        gapCounter.labels(symbol, timeframe.getLabel()).inc();
        missingCandlesCounter.labels(symbol, timeframe.getLabel()).inc(missingCandles);
    }

    @Override
    public void recordRejectedCandle(String symbol, Timeframe timeframe, String reason) {
        rejectedCounter.labels(symbol, timeframe.getLabel(), reason).inc();
    }

    @Override
    public void recordBackfill(String symbol, Timeframe timeframe, boolean success, int recovered,
                               Duration latency) {
        backfillCounter.labels(symbol, timeframe.getLabel(), success ? "success" : "failure").inc();
        backfillLatency.labels(timeframe.getLabel()).observe(latency.toMillis() / 1000.0);
        log.debug("Recorded backfill: {} {} success={} recovered={} latency={}ms",
            symbol, timeframe, success, recovered, latency.toMillis());
    }

    /**
     * Get Prometheus registry for the /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}

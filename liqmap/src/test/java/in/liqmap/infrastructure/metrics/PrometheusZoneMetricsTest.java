package in.liqmap.infrastructure.metrics;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.FilterStage;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PrometheusZoneMetricsTest {

    private static final String[] SYMBOL_TF = {"symbol", "timeframe"};

    private CollectorRegistry registry;
    private PrometheusZoneMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusZoneMetrics(registry);
    }

    private Double sample(String name, String[] labels, String... values) {
        return registry.getSampleValue(name, labels, values);
    }

    @Test
    void recordZonesCreated_accumulatesPerSymbolAndTimeframe() {
        metrics.recordZonesCreated("BTCUSDT", Timeframe.M5, 2);
        metrics.recordZonesCreated("BTCUSDT", Timeframe.M5, 3);
        metrics.recordZonesCreated("BTCUSDT", Timeframe.H1, 1);

        assertEquals(5.0, sample("liqmap_zones_created_total", SYMBOL_TF, "BTCUSDT", "5m"));
        assertEquals(1.0, sample("liqmap_zones_created_total", SYMBOL_TF, "BTCUSDT", "1h"));
    }

    @Test
    void nonPositiveCounts_areIgnored() {
        metrics.recordZonesCreated("BTCUSDT", Timeframe.M5, 0);
        metrics.recordFiltered("BTCUSDT", Timeframe.M5, FilterStage.VOLUME, -1);

        assertNull(sample("liqmap_zones_created_total", SYMBOL_TF, "BTCUSDT", "5m"),
            "no child series should be created for zero counts");
        assertNull(sample("liqmap_zone_filtered_total", new String[]{"symbol", "timeframe", "stage"},
            "BTCUSDT", "5m", FilterStage.VOLUME.label()));
    }

    @Test
    void recordFiltered_labelsByStage() {
        metrics.recordFiltered("BTCUSDT", Timeframe.M15, FilterStage.DISTANCE, 4);
        metrics.recordFiltered("BTCUSDT", Timeframe.M15, FilterStage.AGE, 1);

        String[] labels = {"symbol", "timeframe", "stage"};
        assertEquals(4.0, sample("liqmap_zone_filtered_total", labels,
            "BTCUSDT", "15m", FilterStage.DISTANCE.label()));
        assertEquals(1.0, sample("liqmap_zone_filtered_total", labels,
            "BTCUSDT", "15m", FilterStage.AGE.label()));
    }

    @Test
    void setActiveZones_overwritesGauge() {
        metrics.setActiveZones("BTCUSDT", Timeframe.M1, 7);
        metrics.setActiveZones("BTCUSDT", Timeframe.M1, 3);

        assertEquals(3.0, sample("liqmap_active_zones", SYMBOL_TF, "BTCUSDT", "1m"));
    }

    @Test
    void recordGap_countsGapsAndMissingCandles() {
        metrics.recordGap("ETHUSDT", Timeframe.M5, 3);
        metrics.recordGap("ETHUSDT", Timeframe.M5, 2);

        assertEquals(2.0, sample("liqmap_gaps_detected_total", SYMBOL_TF, "ETHUSDT", "5m"));
        assertEquals(5.0, sample("liqmap_missing_candles_total", SYMBOL_TF, "ETHUSDT", "5m"));
    }

    @Test
    void recordRejectedCandle_labelsByReason() {
        metrics.recordRejectedCandle("ETHUSDT", Timeframe.M5, "stale");
        metrics.recordRejectedCandle("ETHUSDT", Timeframe.M5, "stale");
        metrics.recordRejectedCandle("ETHUSDT", Timeframe.M5, "invalid");

        String[] labels = {"symbol", "timeframe", "reason"};
        assertEquals(2.0, sample("liqmap_rejected_candles_total", labels, "ETHUSDT", "5m", "stale"));
        assertEquals(1.0, sample("liqmap_rejected_candles_total", labels, "ETHUSDT", "5m", "invalid"));
    }

    @Test
    void recordBackfill_countsOutcomeAndObservesLatency() {
        metrics.recordBackfill("BTCUSDT", Timeframe.M5, true, 4, Duration.ofMillis(120));
        metrics.recordBackfill("BTCUSDT", Timeframe.M5, false, 0, Duration.ofMillis(80));

        String[] labels = {"symbol", "timeframe", "outcome"};
        assertEquals(1.0, sample("liqmap_backfill_total", labels, "BTCUSDT", "5m", "success"));
        assertEquals(1.0, sample("liqmap_backfill_total", labels, "BTCUSDT", "5m", "failure"));
        assertEquals(2.0, sample("liqmap_backfill_latency_seconds_count", new String[]{"timeframe"}, "5m"));
        assertEquals(0.2, sample("liqmap_backfill_latency_seconds_sum", new String[]{"timeframe"}, "5m"), 1e-9);
    }
}

package in.liqmap.infrastructure.metrics;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.FilterStage;

import java.time.Duration;

/**
 * Metrics sink for candle sync and zone refresh.
 *
 * Implementations can publish to Prometheus or any other monitoring backend.
 */
public interface ZoneMetrics {

    /**
     * Record zones (or a whole refresh, for {@link FilterStage#ATR}) discarded by a stage.
     *
     * @param symbol    Trading symbol
     * @param timeframe Timeframe refreshed
     * @param stage     Stage that filtered
     * @param count     Number of items filtered
     */
    void recordFiltered(String symbol, Timeframe timeframe, FilterStage stage, int count);

    /**
     * Record newly created zones after filtering and merge.
     */
    void recordZonesCreated(String symbol, Timeframe timeframe, int count);

    /**
     * Publish the current zone-set size.
     */
    void setActiveZones(String symbol, Timeframe timeframe, int count);

    /**
     * Record a detected sequence gap.
     *
     * @param missingCandles Number of missing intervals in the gap
     */
    void recordGap(String symbol, Timeframe timeframe, long missingCandles);

    /**
     * Record a rejected stale or invalid candle.
     */
    void recordRejectedCandle(String symbol, Timeframe timeframe, String reason);

    /**
     * Record a finished backfill request.
     *
     * @param success   Whether the fetch completed without error
     * @param recovered Candles recovered inside the gap range
     * @param latency   Time the fetch took
     */
    void recordBackfill(String symbol, Timeframe timeframe, boolean success, int recovered, Duration latency);
}

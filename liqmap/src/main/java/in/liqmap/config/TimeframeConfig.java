package in.liqmap.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.liqmap.domain.data.Timeframe;

/**
 * Per-timeframe tuning for zone detection, filtering, sweeps and confluence.
 *
 * Immutable and validated on construction; out-of-range values throw instead of being clamped.
 * Defaults come from {@link #defaults(Timeframe)}; use {@link #builder(Timeframe)} or
 * {@link #toBuilder()} to derive variants.
 */
public record TimeframeConfig(
    @JsonProperty("pivotLeft")
    int pivotLeft,                  // candles left of a pivot that must be lower/higher

    @JsonProperty("pivotRight")
    int pivotRight,                 // candles right of a pivot (confirmation delay)

    @JsonProperty("lookbackCandles")
    int lookbackCandles,            // candles analysed per refresh

    @JsonProperty("maxZoneAgeCandles")
    int maxZoneAgeCandles,          // zones older than this are removed

    @JsonProperty("minVolumePercentile")
    double minVolumePercentile,     // volume-profile bins below this percentile are ignored

    @JsonProperty("volumeSpikeMultiplier")
    double volumeSpikeMultiplier,   // origin candle volume / trailing average required

    @JsonProperty("zoneBufferPct")
    double zoneBufferPct,           // half-width of a pivot zone as fraction of price

    @JsonProperty("mergeRadiusPct")
    double mergeRadiusPct,          // zones closer than this merge / group for confluence

    @JsonProperty("minZoneDistancePct")
    double minZoneDistancePct,      // candidates closer than this to price are dropped

    @JsonProperty("atrMinMultiplier")
    double atrMinMultiplier,        // ATR below min x baseline skips detection

    @JsonProperty("atrMaxMultiplier")
    double atrMaxMultiplier,        // ATR above max x baseline skips detection

    @JsonProperty("sweepPenetrationPct")
    double sweepPenetrationPct,     // wick beyond a level needed to count as a sweep

    @JsonProperty("sweepRejectionPct")
    double sweepRejectionPct,       // move back from the level needed to confirm the sweep

    @JsonProperty("tfWeight")
    int tfWeight,                   // confluence weight of this timeframe

    @JsonProperty("description")
    String description
) {
    public static final int MIN_PIVOT = 1;
    public static final int MAX_PIVOT = 20;
    public static final double MAX_PCT = 0.01;

    public TimeframeConfig {
        requireRange("pivotLeft", pivotLeft, MIN_PIVOT, MAX_PIVOT);
        requireRange("pivotRight", pivotRight, MIN_PIVOT, MAX_PIVOT);
        requireRange("lookbackCandles", lookbackCandles, 10, 500);
        requireRange("maxZoneAgeCandles", maxZoneAgeCandles, 10, 1000);
        requireRange("minVolumePercentile", minVolumePercentile, 0, 100);
        requireRange("volumeSpikeMultiplier", volumeSpikeMultiplier, 1.0, 5.0);
        requireRange("zoneBufferPct", zoneBufferPct, 0, MAX_PCT);
        requireRange("mergeRadiusPct", mergeRadiusPct, 0, MAX_PCT);
        requireRange("minZoneDistancePct", minZoneDistancePct, 0, MAX_PCT);
        requireRange("atrMinMultiplier", atrMinMultiplier, 0.1, 2.0);
        requireRange("atrMaxMultiplier", atrMaxMultiplier, 0.5, 5.0);
        requireRange("sweepPenetrationPct", sweepPenetrationPct, 0.0001, MAX_PCT);
        requireRange("sweepRejectionPct", sweepRejectionPct, 0.0001, MAX_PCT);
        requireRange("tfWeight", tfWeight, 1, 10);
        if (atrMinMultiplier >= atrMaxMultiplier) {
            throw new IllegalArgumentException(
                "atrMinMultiplier (" + atrMinMultiplier + ") must be below atrMaxMultiplier (" + atrMaxMultiplier + ")");
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Default configuration for a timeframe.
     *
     * Higher timeframes use wider pivots, longer zone lifetimes and looser sweep thresholds.
     */
    public static TimeframeConfig defaults(Timeframe timeframe) {
        return switch (timeframe) {
            case H1 -> new TimeframeConfig(8, 8, 120, 200, 75, 2.2, 0.002, 0.0025, 0.0015,
                0.8, 2.5, 0.002, 0.0012, 4, "1h: strong confirmation, long-lived zones");
            case M15 -> new TimeframeConfig(5, 5, 100, 150, 70, 1.8, 0.0015, 0.0018, 0.001,
                0.7, 2.0, 0.0012, 0.0008, 3, "15m: balanced structure");
            case M5 -> new TimeframeConfig(4, 4, 100, 100, 70, 1.6, 0.001, 0.0015, 0.0008,
                0.6, 1.8, 0.0008, 0.0006, 2, "5m: intraday structure");
            case M1 -> new TimeframeConfig(3, 3, 80, 40, 65, 1.5, 0.0008, 0.0012, 0.0005,
                0.5, 1.5, 0.0006, 0.0005, 1, "1m: fast, short-lived zones");
        };
    }

    /**
     * Default configuration for a timeframe label; unknown labels resolve to the 5m defaults.
     */
    public static TimeframeConfig defaults(String timeframeLabel) {
        return defaults(Timeframe.fromLabel(timeframeLabel).orElse(Timeframe.M5));
    }

    public static Builder builder(Timeframe timeframe) {
        return new Builder(defaults(timeframe));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(
                name + " must be within [" + min + ", " + max + "], got " + value);
        }
    }

    /**
     * Fluent builder; validation happens in {@link #build()}.
     */
    public static final class Builder {
        private int pivotLeft;
        private int pivotRight;
        private int lookbackCandles;
        private int maxZoneAgeCandles;
        private double minVolumePercentile;
        private double volumeSpikeMultiplier;
        private double zoneBufferPct;
        private double mergeRadiusPct;
        private double minZoneDistancePct;
        private double atrMinMultiplier;
        private double atrMaxMultiplier;
        private double sweepPenetrationPct;
        private double sweepRejectionPct;
        private int tfWeight;
        private String description;

        private Builder(TimeframeConfig base) {
            this.pivotLeft = base.pivotLeft;
            this.pivotRight = base.pivotRight;
            this.lookbackCandles = base.lookbackCandles;
            this.maxZoneAgeCandles = base.maxZoneAgeCandles;
            this.minVolumePercentile = base.minVolumePercentile;
            this.volumeSpikeMultiplier = base.volumeSpikeMultiplier;
            this.zoneBufferPct = base.zoneBufferPct;
            this.mergeRadiusPct = base.mergeRadiusPct;
            this.minZoneDistancePct = base.minZoneDistancePct;
            this.atrMinMultiplier = base.atrMinMultiplier;
            this.atrMaxMultiplier = base.atrMaxMultiplier;
            this.sweepPenetrationPct = base.sweepPenetrationPct;
            this.sweepRejectionPct = base.sweepRejectionPct;
            this.tfWeight = base.tfWeight;
            this.description = base.description;
        }

        public Builder pivotLeft(int v) { this.pivotLeft = v; return this; }
        public Builder pivotRight(int v) { this.pivotRight = v; return this; }
        public Builder lookbackCandles(int v) { this.lookbackCandles = v; return this; }
        public Builder maxZoneAgeCandles(int v) { this.maxZoneAgeCandles = v; return this; }
        public Builder minVolumePercentile(double v) { this.minVolumePercentile = v; return this; }
        public Builder volumeSpikeMultiplier(double v) { this.volumeSpikeMultiplier = v; return this; }
        public Builder zoneBufferPct(double v) { this.zoneBufferPct = v; return this; }
        public Builder mergeRadiusPct(double v) { this.mergeRadiusPct = v; return this; }
        public Builder minZoneDistancePct(double v) { this.minZoneDistancePct = v; return this; }
        public Builder atrMinMultiplier(double v) { this.atrMinMultiplier = v; return this; }
        public Builder atrMaxMultiplier(double v) { this.atrMaxMultiplier = v; return this; }
        public Builder sweepPenetrationPct(double v) { this.sweepPenetrationPct = v; return this; }
        public Builder sweepRejectionPct(double v) { this.sweepRejectionPct = v; return this; }
        public Builder tfWeight(int v) { this.tfWeight = v; return this; }
        public Builder description(String v) { this.description = v; return this; }

        public TimeframeConfig build() {
            return new TimeframeConfig(pivotLeft, pivotRight, lookbackCandles, maxZoneAgeCandles,
                minVolumePercentile, volumeSpikeMultiplier, zoneBufferPct, mergeRadiusPct,
                minZoneDistancePct, atrMinMultiplier, atrMaxMultiplier, sweepPenetrationPct,
                sweepRejectionPct, tfWeight, description);
        }
    }
}

package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.TrendState;

/**
 * Trend-aware parameter adaptation for one refresh.
 *
 * Strong trends: faster pivots, tighter zones, stricter volume threshold.
 * Weak trends: slower pivots, wider zones, looser volume threshold.
 * Results are clamped into valid config bounds; the input config is never modified.
 */
public final class TrendAdapter {

    static final double STRONG_PIVOT_FACTOR = 0.7;
    static final double WEAK_PIVOT_FACTOR = 1.2;
    static final double STRONG_BUFFER_FACTOR = 0.8;
    static final double WEAK_BUFFER_FACTOR = 1.2;
    static final double VOLUME_PERCENTILE_STEP = 5.0;
    static final double MIN_VOLUME_PERCENTILE = 50.0;
    static final double MAX_VOLUME_PERCENTILE = 90.0;

    /**
     * Adapt config to the trend; returns the config itself for null or neutral trends.
     */
    public static TimeframeConfig adapt(TimeframeConfig config, TrendState trend) {
        if (trend == null) {
            return config;
        }

        double pivotFactor;
        double bufferFactor;
        double volumeStep;
        if (trend.strength().isStrong()) {
            pivotFactor = STRONG_PIVOT_FACTOR;
            bufferFactor = STRONG_BUFFER_FACTOR;
            volumeStep = VOLUME_PERCENTILE_STEP;
        } else if (trend.strength().isWeak()) {
            pivotFactor = WEAK_PIVOT_FACTOR;
            bufferFactor = WEAK_BUFFER_FACTOR;
            volumeStep = -VOLUME_PERCENTILE_STEP;
        } else {
            return config;
        }

        return config.toBuilder()
            .pivotLeft(scalePivot(config.pivotLeft(), pivotFactor))
            .pivotRight(scalePivot(config.pivotRight(), pivotFactor))
            .zoneBufferPct(Math.min(TimeframeConfig.MAX_PCT, config.zoneBufferPct() * bufferFactor))
            .minVolumePercentile(clamp(config.minVolumePercentile() + volumeStep,
                MIN_VOLUME_PERCENTILE, MAX_VOLUME_PERCENTILE))
            .build();
    }

    private static int scalePivot(int pivot, double factor) {
        int scaled = (int) Math.round(pivot * factor);
        return Math.max(TimeframeConfig.MIN_PIVOT, Math.min(TimeframeConfig.MAX_PIVOT, scaled));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private TrendAdapter() {}
}

package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;

/**
 * Three-candle price imbalance between the outer candles' wicks.
 */
public record FairValueGap(
    String id,
    Timeframe timeframe,
    PatternDirection direction,
    double gapHigh,
    double gapLow,
    long createdTs,
    double volumeBefore,
    int touchCount,
    Long lastTestTs,
    double fillPercentage,
    boolean filled
) {
    /** Fill percentage at which a gap counts as filled. */
    public static final double FILLED_THRESHOLD = 75.0;

    public static FairValueGap detected(String id, Timeframe timeframe, PatternDirection direction,
                                        double gapHigh, double gapLow, long createdTs,
                                        double volumeBefore) {
        return new FairValueGap(id, timeframe, direction, gapHigh, gapLow, createdTs,
            volumeBefore, 0, null, 0.0, false);
    }

    public double gapSize() {
        return gapHigh - gapLow;
    }

    public double midpoint() {
        return (gapHigh + gapLow) / 2.0;
    }

    public FairValueGap touched(long ts, double newFillPercentage) {
        double fill = Math.min(100.0, Math.max(fillPercentage, newFillPercentage));
        return new FairValueGap(id, timeframe, direction, gapHigh, gapLow, createdTs,
            volumeBefore, touchCount + 1, ts, fill, fill >= FILLED_THRESHOLD);
    }
}

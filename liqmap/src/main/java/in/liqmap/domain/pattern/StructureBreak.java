package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendDirection;

/**
 * Close through a confirmed swing point.
 *
 * BOS continues the prevailing trend, CHOCH reverses it.
 */
public record StructureBreak(
    String id,
    Timeframe timeframe,
    BreakType type,
    PatternDirection direction,
    double breakPrice,
    double structurePrice,
    long timestamp,
    TrendDirection previousTrend
) {
    public enum BreakType {
        BOS,
        CHOCH
    }
}

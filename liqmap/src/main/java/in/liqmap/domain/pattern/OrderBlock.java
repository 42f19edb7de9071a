package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.ZoneStrength;

/**
 * Order block: the last opposite-coloured candle before an impulsive move.
 *
 * A bullish block is the last bearish candle before an up-impulse; a bearish block the last
 * bullish candle before a down-impulse. A block that price closes through becomes a breaker.
 *
 * @param createdTs open time of the block candle
 * @param impulseTs open time of the impulse candle; tests only count after it
 */
public record OrderBlock(
    String id,
    Timeframe timeframe,
    PatternDirection direction,
    double priceHigh,
    double priceLow,
    long createdTs,
    long impulseTs,
    double volume,
    ZoneStrength strength,
    int touchCount,
    Long lastTestTs,
    boolean mitigated,
    boolean breaker
) {
    public static OrderBlock detected(String id, Timeframe timeframe, PatternDirection direction,
                                      double priceHigh, double priceLow, long createdTs,
                                      long impulseTs, double volume, ZoneStrength strength) {
        return new OrderBlock(id, timeframe, direction, priceHigh, priceLow, createdTs, impulseTs, volume,
            strength, 0, null, false, false);
    }

    public double midpoint() {
        return (priceHigh + priceLow) / 2.0;
    }

    public boolean isActive() {
        return !mitigated && !breaker;
    }

    /**
     * Record a test of the block at ts; the first test mitigates it.
     */
    public OrderBlock tested(long ts) {
        return new OrderBlock(id, timeframe, direction, priceHigh, priceLow, createdTs, impulseTs, volume,
            strength, touchCount + 1, ts, true, breaker);
    }

    public OrderBlock broken() {
        return new OrderBlock(id, timeframe, direction, priceHigh, priceLow, createdTs, impulseTs, volume,
            strength, touchCount, lastTestTs, mitigated, true);
    }
}

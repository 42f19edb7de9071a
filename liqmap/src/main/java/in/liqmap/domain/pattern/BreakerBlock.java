package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.ZoneStrength;

/**
 * Failed order block with flipped polarity.
 */
public record BreakerBlock(
    String id,
    Timeframe timeframe,
    PatternDirection direction,
    double priceHigh,
    double priceLow,
    PatternDirection originalDirection,
    long breakTs,
    long createdTs,
    ZoneStrength strength,
    int testCount,
    Long lastTestTs,
    boolean invalidated
) {
    /**
     * Flip a broken order block into a breaker.
     */
    public static BreakerBlock fromBrokenOrderBlock(String id, OrderBlock ob, long breakTs) {
        return new BreakerBlock(id, ob.timeframe(), ob.direction().opposite(), ob.priceHigh(),
            ob.priceLow(), ob.direction(), breakTs, ob.createdTs(), ob.strength(), 0, null, false);
    }

    public boolean isTested() {
        return testCount > 0;
    }

    public double midpoint() {
        return (priceHigh + priceLow) / 2.0;
    }

    public BreakerBlock tested(long ts) {
        return new BreakerBlock(id, timeframe, direction, priceHigh, priceLow, originalDirection,
            breakTs, createdTs, strength, testCount + 1, ts, invalidated);
    }

    public BreakerBlock invalidate() {
        return new BreakerBlock(id, timeframe, direction, priceHigh, priceLow, originalDirection,
            breakTs, createdTs, strength, testCount, lastTestTs, true);
    }
}

package in.liqmap.domain.zone;

import in.liqmap.domain.data.Timeframe;

import java.util.Objects;

/**
 * Price range where a reaction is expected.
 *
 * Immutable: state changes (touch, mitigation, confluence weight) produce a new instance, so
 * zones handed out by queries can never be used to mutate the owning zone set.
 */
public record LiquidityZone(
    String id,
    Timeframe timeframe,
    ZoneKind kind,
    ZoneSide side,
    double priceLow,
    double priceHigh,
    long createdTs,
    ZoneStrength strength,
    int touchCount,
    double volume,
    boolean mitigated,
    int confluenceWeight
) {
    public LiquidityZone {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(strength, "strength");
        if (Double.isNaN(priceLow) || Double.isNaN(priceHigh)) {
            throw new IllegalArgumentException("Zone " + id + " has NaN bounds");
        }
        if (priceLow > priceHigh) {
            throw new IllegalArgumentException(
                "Zone " + id + " priceLow " + priceLow + " > priceHigh " + priceHigh);
        }
        if (touchCount < 0) {
            throw new IllegalArgumentException("Zone " + id + " touchCount < 0: " + touchCount);
        }
    }

    /**
     * Create a fresh, untouched zone.
     */
    public static LiquidityZone of(String id, Timeframe timeframe, ZoneKind kind, ZoneSide side,
                                   double priceLow, double priceHigh, long createdTs,
                                   ZoneStrength strength, double volume) {
        return new LiquidityZone(id, timeframe, kind, side, priceLow, priceHigh, createdTs,
            strength, 0, volume, false, 0);
    }

    public double midpoint() {
        return (priceLow + priceHigh) / 2.0;
    }

    public double width() {
        return priceHigh - priceLow;
    }

    public boolean contains(double price) {
        return price >= priceLow && price <= priceHigh;
    }

    /**
     * Age in whole candles relative to currentTs.
     */
    public long ageInCandles(long currentTs) {
        return (currentTs - createdTs) / timeframe.getIntervalSeconds();
    }

    /**
     * True when the two ranges overlap once each is widened by radiusPct of its own midpoint.
     */
    public boolean overlapsWithin(LiquidityZone other, double radiusPct) {
        double pad = midpoint() * radiusPct;
        double otherPad = other.midpoint() * radiusPct;
        return priceLow - pad <= other.priceHigh + otherPad
            && other.priceLow - otherPad <= priceHigh + pad;
    }

    public LiquidityZone withTouchCount(int newTouchCount) {
        return new LiquidityZone(id, timeframe, kind, side, priceLow, priceHigh, createdTs,
            strength, newTouchCount, volume, mitigated, confluenceWeight);
    }

    public LiquidityZone withStrength(ZoneStrength newStrength) {
        return new LiquidityZone(id, timeframe, kind, side, priceLow, priceHigh, createdTs,
            newStrength, touchCount, volume, mitigated, confluenceWeight);
    }

    public LiquidityZone withMitigated(boolean newMitigated) {
        return new LiquidityZone(id, timeframe, kind, side, priceLow, priceHigh, createdTs,
            strength, touchCount, volume, newMitigated, confluenceWeight);
    }

    public LiquidityZone withConfluenceWeight(int weight) {
        return new LiquidityZone(id, timeframe, kind, side, priceLow, priceHigh, createdTs,
            strength, touchCount, volume, mitigated, weight);
    }
}

package in.liqmap.domain.zone;

import in.liqmap.domain.data.Timeframe;

/**
 * Premium/discount split of the range spanned by the last refresh window.
 *
 * The equilibrium band covers 45%..55% of the range. A zero-width range classifies every
 * price as equilibrium.
 */
public record PremiumDiscount(Timeframe timeframe, double rangeLow, double rangeHigh) {

    /** Half-width of the equilibrium band as a fraction of the range. */
    public static final double EQUILIBRIUM_BAND = 0.05;

    public PremiumDiscount {
        if (rangeHigh < rangeLow) {
            throw new IllegalArgumentException("rangeHigh " + rangeHigh + " below rangeLow " + rangeLow);
        }
    }

    public double rangeSize() {
        return rangeHigh - rangeLow;
    }

    public double equilibrium() {
        return rangeLow + rangeSize() * 0.5;
    }

    public PdPosition classify(double price) {
        double range = rangeSize();
        if (range == 0.0) {
            return PdPosition.EQUILIBRIUM;
        }
        if (price > rangeLow + range * (0.5 + EQUILIBRIUM_BAND)) {
            return PdPosition.PREMIUM;
        }
        if (price < rangeLow + range * (0.5 - EQUILIBRIUM_BAND)) {
            return PdPosition.DISCOUNT;
        }
        return PdPosition.EQUILIBRIUM;
    }

    /**
     * Signed distance from equilibrium as a percentage of the range; positive above.
     */
    public double equilibriumDistancePct(double price) {
        double range = rangeSize();
        if (range == 0.0) {
            return 0.0;
        }
        return (price - equilibrium()) / range * 100.0;
    }
}

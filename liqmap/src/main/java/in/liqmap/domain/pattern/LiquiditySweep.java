package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.ZoneStrength;

/**
 * Stop hunt through a liquidity level, optionally confirmed by a reversal.
 */
public record LiquiditySweep(
    String id,
    Timeframe timeframe,
    SweepType type,
    double levelPrice,
    double sweepPrice,
    long sweepTs,
    Double reversalPrice,
    Long reversalTs,
    boolean confirmed,
    ZoneStrength strength
) {
    public enum SweepType {
        /** Highs taken out, reversal expected down. */
        BUY_SIDE,

        /** Lows taken out, reversal expected up. */
        SELL_SIDE
    }

    public static LiquiditySweep unconfirmed(String id, Timeframe timeframe, SweepType type,
                                             double levelPrice, double sweepPrice, long sweepTs) {
        return new LiquiditySweep(id, timeframe, type, levelPrice, sweepPrice, sweepTs,
            null, null, false, ZoneStrength.MODERATE);
    }

    public LiquiditySweep confirmedBy(double price, long ts) {
        return new LiquiditySweep(id, timeframe, type, levelPrice, sweepPrice, sweepTs,
            price, ts, true, ZoneStrength.STRONG);
    }

    public double sweepDistance() {
        return Math.abs(sweepPrice - levelPrice);
    }
}

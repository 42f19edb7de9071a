package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.LiquidityLevel;
import in.liqmap.domain.pattern.LiquidityLevel.LevelType;
import in.liqmap.domain.pattern.LiquiditySweep;
import in.liqmap.domain.pattern.LiquiditySweep.SweepType;
import in.liqmap.domain.zone.ZoneStrength;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Liquidity sweeps derived from swept levels of the {@link LiquidityLevelPlugin}.
 *
 * A swept BSL is a buy-side sweep, a swept SSL a sell-side sweep. The sweep is confirmed when,
 * within {@value #REVERSAL_WINDOW} candles, price moves back from the level by at least the
 * configured rejection fraction of the level price.
 */
public final class LiquiditySweepPlugin extends AbstractLiquidityPlugin<LiquiditySweep> {
    public static final String NAME = "liquidity_sweep";

    static final int REVERSAL_WINDOW = 5;
    static final int LEVELS_CHECKED = 20;
    static final int MAX_SWEEPS = 100;

    private final LiquidityLevelPlugin levels;

    public LiquiditySweepPlugin(String symbol, Timeframe timeframe, LiquidityLevelPlugin levels) {
        super(symbol, timeframe, MAX_SWEEPS);
        this.levels = Objects.requireNonNull(levels, "levels");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(LiquiditySweep pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(LiquiditySweep pattern) {
        return !pattern.confirmed();
    }

    @Override
    protected List<LiquiditySweep> findPatterns(List<Candle> candles, TimeframeConfig config) {
        List<LiquiditySweep> found = new ArrayList<>();
        for (LiquidityLevel level : levels.getRecentSweeps(LEVELS_CHECKED)) {
            int idx = indexOf(candles, level.sweepTs());
            if (idx < 0) {
                continue;
            }
            Candle sweepCandle = candles.get(idx);
            SweepType type = level.type() == LevelType.BSL ? SweepType.BUY_SIDE : SweepType.SELL_SIDE;
            double sweepPrice = type == SweepType.BUY_SIDE ? sweepCandle.high() : sweepCandle.low();
            LiquiditySweep sweep = LiquiditySweep.unconfirmed(idPrefix() + "sweep_" + level.id(), timeframe,
                type, level.price(), sweepPrice, sweepCandle.openTs());
            found.add(checkReversal(sweep, candles, config.sweepRejectionPct()));
        }
        return found;
    }

    @Override
    protected List<LiquiditySweep> refreshPatterns(List<LiquiditySweep> current, List<Candle> candles,
                                                   double currentPrice, TimeframeConfig config) {
        List<LiquiditySweep> refreshed = new ArrayList<>(current.size());
        for (LiquiditySweep sweep : current) {
            refreshed.add(sweep.confirmed() ? sweep : checkReversal(sweep, candles, config.sweepRejectionPct()));
        }
        return refreshed;
    }

    private LiquiditySweep checkReversal(LiquiditySweep sweep, List<Candle> candles, double rejectionPct) {
        long windowEnd = sweep.sweepTs() + REVERSAL_WINDOW * timeframe.getIntervalSeconds();
        double level = sweep.levelPrice();
        for (Candle c : candles) {
            if (c.openTs() <= sweep.sweepTs() || c.openTs() > windowEnd) {
                continue;
            }
            if (sweep.type() == SweepType.BUY_SIDE && (level - c.low()) / level >= rejectionPct) {
                return sweep.confirmedBy(c.low(), c.openTs());
            }
            if (sweep.type() == SweepType.SELL_SIDE && (c.high() - level) / level >= rejectionPct) {
                return sweep.confirmedBy(c.high(), c.openTs());
            }
        }
        return sweep;
    }

    private static int indexOf(List<Candle> candles, long openTs) {
        for (int i = candles.size() - 1; i >= 0; i--) {
            if (candles.get(i).openTs() == openTs) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Sweeps filtered by type (null matches any), confirmation and minimum strength.
     */
    public List<LiquiditySweep> getSweeps(SweepType type, boolean confirmedOnly, ZoneStrength minStrength) {
        return get(s -> (type == null || s.type() == type)
            && (!confirmedOnly || s.confirmed())
            && (minStrength == null || s.strength().isAtLeast(minStrength)));
    }
}

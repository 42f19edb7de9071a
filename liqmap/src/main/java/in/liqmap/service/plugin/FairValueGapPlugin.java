package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.FairValueGap;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneStrength;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Fair value gap detection over three-candle windows (prev, curr, next).
 *
 * Bullish: prev.low above next.high, the gap spans [next.high, prev.low].
 * Bearish: prev.high below next.low, the gap spans [prev.high, next.low].
 *
 * Update: each later candle overlapping the gap counts a touch and raises the fill percentage;
 * at {@link FairValueGap#FILLED_THRESHOLD} percent the gap is filled.
 */
public final class FairValueGapPlugin extends AbstractLiquidityPlugin<FairValueGap> {
    public static final String NAME = "fair_value_gap";

    static final int UPDATE_WINDOW = 10;
    static final int MAX_FILLED = 50;
    static final int MAX_GAPS = 500;

    public FairValueGapPlugin(String symbol, Timeframe timeframe) {
        super(symbol, timeframe, MAX_GAPS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(FairValueGap pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(FairValueGap pattern) {
        return !pattern.filled();
    }

    @Override
    protected List<FairValueGap> findPatterns(List<Candle> candles, TimeframeConfig config) {
        int n = candles.size();
        if (n < 3) {
            return List.of();
        }

        List<FairValueGap> found = new ArrayList<>();
        int start = Math.max(1, n - config.lookbackCandles());
        for (int i = start; i < n - 1; i++) {
            Candle prev = candles.get(i - 1);
            Candle curr = candles.get(i);
            Candle next = candles.get(i + 1);

            if (prev.low() > next.high()) {
                found.add(FairValueGap.detected(idPrefix() + "fvg_bull_" + curr.openTs(), timeframe,
                    PatternDirection.BULLISH, prev.low(), next.high(), curr.openTs(), prev.volume()));
            } else if (prev.high() < next.low()) {
                found.add(FairValueGap.detected(idPrefix() + "fvg_bear_" + curr.openTs(), timeframe,
                    PatternDirection.BEARISH, next.low(), prev.high(), curr.openTs(), prev.volume()));
            }
        }
        return found;
    }

    @Override
    protected List<FairValueGap> refreshPatterns(List<FairValueGap> current, List<Candle> candles,
                                                 double currentPrice, TimeframeConfig config) {
        List<Candle> recent = tail(candles, UPDATE_WINDOW);
        List<FairValueGap> refreshed = new ArrayList<>(current.size());
        for (FairValueGap gap : current) {
            refreshed.add(gap.filled() ? gap : refresh(gap, recent));
        }
        return refreshed;
    }

    private FairValueGap refresh(FairValueGap gap, List<Candle> recent) {
        // The third candle of the pattern bounds the gap and never counts as a touch.
        long firstEligible = gap.createdTs() + timeframe.getIntervalSeconds();
        FairValueGap result = gap;
        for (Candle c : recent) {
            if (c.openTs() <= firstEligible
                || (result.lastTestTs() != null && c.openTs() <= result.lastTestTs())) {
                continue;
            }
            if (c.low() > result.gapHigh() || c.high() < result.gapLow()) {
                continue;
            }

            double filled = result.direction() == PatternDirection.BULLISH
                ? result.gapHigh() - Math.min(c.low(), result.gapHigh())
                : Math.max(c.high(), result.gapLow()) - result.gapLow();
            double size = result.gapSize();
            double pct = size > 0 ? Math.min(100.0, filled / size * 100.0) : 100.0;
            result = result.touched(c.openTs(), pct);
            if (result.filled()) {
                break;
            }
        }
        return result;
    }

    @Override
    protected List<FairValueGap> retain(List<FairValueGap> all) {
        List<FairValueGap> unfilled = new ArrayList<>();
        List<FairValueGap> filled = new ArrayList<>();
        for (FairValueGap gap : all) {
            (gap.filled() ? filled : unfilled).add(gap);
        }
        if (filled.size() > MAX_FILLED) {
            filled.sort(Comparator.comparingLong(FairValueGap::createdTs));
            filled = filled.subList(filled.size() - MAX_FILLED, filled.size());
        }
        List<FairValueGap> kept = new ArrayList<>(unfilled);
        kept.addAll(filled);
        return super.retain(kept);
    }

    @Override
    public Optional<LiquidityZone> toZone(FairValueGap pattern, TimeframeConfig config) {
        if (pattern.filled()) {
            return Optional.empty();
        }
        return Optional.of(LiquidityZone.of(pattern.id(), timeframe, ZoneKind.FAIR_VALUE_GAP,
            pattern.direction().side(), pattern.gapLow(), pattern.gapHigh(), pattern.createdTs(),
            ZoneStrength.MODERATE, pattern.volumeBefore()));
    }

    /**
     * Unfilled gaps, optionally of one direction, newest first.
     */
    public List<FairValueGap> getUnfilled(PatternDirection direction) {
        List<FairValueGap> result = get(g -> !g.filled() && (direction == null || g.direction() == direction));
        result.sort(Comparator.comparingLong(FairValueGap::createdTs).reversed());
        return result;
    }

    /**
     * Nearest unfilled gap by midpoint distance.
     */
    public Optional<FairValueGap> getNearest(double price, SearchDirection direction) {
        return getUnfilled(null).stream()
            .filter(g -> switch (direction) {
                case ABOVE -> g.gapLow() > price;
                case BELOW -> g.gapHigh() < price;
                case BOTH -> true;
            })
            .min(Comparator.comparingDouble(g -> Math.abs(g.midpoint() - price)));
    }
}

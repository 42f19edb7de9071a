package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendDirection;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.pattern.StructureBreak;
import in.liqmap.domain.pattern.StructureBreak.BreakType;
import in.liqmap.service.indicator.PivotDetector;
import in.liqmap.service.indicator.PivotDetector.Pivot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Market structure: break of structure (BOS) and change of character (CHOCH).
 *
 * Swing points use a symmetric {@value #SWING_LOOKBACK}-candle window. A close above a confirmed
 * swing high is a bullish break: BOS while the trend is already up, otherwise CHOCH and the
 * trend flips to up. Bearish breaks mirror this. Each swing point is broken at most once.
 */
public final class StructureBreakPlugin extends AbstractLiquidityPlugin<StructureBreak> {
    public static final String NAME = "structure_break";

    static final int SWING_LOOKBACK = 5;
    static final int SWING_WINDOW = 100;
    static final int MAX_SWINGS = 50;
    static final int SCAN_WINDOW = 50;
    static final int MAX_BREAKS = 50;

    private final Map<Long, Pivot> swingHighs = new LinkedHashMap<>();
    private final Map<Long, Pivot> swingLows = new LinkedHashMap<>();
    private final Set<Long> brokenSwings = new HashSet<>();
    private long lastProcessedTs = Long.MIN_VALUE;
    private volatile TrendDirection trend = TrendDirection.RANGING;

    public StructureBreakPlugin(String symbol, Timeframe timeframe) {
        super(symbol, timeframe, MAX_BREAKS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(StructureBreak pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(StructureBreak pattern) {
        return true;
    }

    @Override
    protected List<StructureBreak> findPatterns(List<Candle> candles, TimeframeConfig config) {
        if (candles.size() < SWING_LOOKBACK * 2 + 5) {
            return List.of();
        }
        updateSwings(candles);

        List<StructureBreak> found = new ArrayList<>();
        for (Candle c : tail(candles, SCAN_WINDOW)) {
            if (c.openTs() <= lastProcessedTs) {
                continue;
            }
            lastProcessedTs = c.openTs();

            Pivot high = firstUnbroken(swingHighs, c, true);
            if (high != null) {
                found.add(breakOf(c, high, PatternDirection.BULLISH));
            }
            Pivot low = firstUnbroken(swingLows, c, false);
            if (low != null) {
                found.add(breakOf(c, low, PatternDirection.BEARISH));
            }
        }
        return found;
    }

    private void updateSwings(List<Candle> candles) {
        List<Candle> window = tail(candles, SWING_WINDOW);
        for (Pivot p : PivotDetector.findSwingHighs(window, SWING_LOOKBACK, SWING_LOOKBACK)) {
            swingHighs.putIfAbsent(p.openTs(), p);
        }
        for (Pivot p : PivotDetector.findSwingLows(window, SWING_LOOKBACK, SWING_LOOKBACK)) {
            swingLows.putIfAbsent(p.openTs(), p);
        }
        trim(swingHighs);
        trim(swingLows);
    }

    private void trim(Map<Long, Pivot> swings) {
        while (swings.size() > MAX_SWINGS) {
            Long oldest = swings.keySet().iterator().next();
            swings.remove(oldest);
            brokenSwings.remove(oldest);
        }
    }

    private Pivot firstUnbroken(Map<Long, Pivot> swings, Candle c, boolean highs) {
        for (Pivot p : swings.values()) {
            if (p.openTs() >= c.openTs() || brokenSwings.contains(p.openTs())) {
                continue;
            }
            if (highs ? c.close() > p.price() : c.close() < p.price()) {
                brokenSwings.add(p.openTs());
                return p;
            }
        }
        return null;
    }

    private StructureBreak breakOf(Candle c, Pivot swing, PatternDirection direction) {
        TrendDirection previous = trend;
        TrendDirection target = direction == PatternDirection.BULLISH ? TrendDirection.UP : TrendDirection.DOWN;
        BreakType type = previous == target ? BreakType.BOS : BreakType.CHOCH;
        trend = target;
        String id = idPrefix() + "break_" + (direction == PatternDirection.BULLISH ? "bull_" : "bear_") + c.openTs();
        return new StructureBreak(id, timeframe, type, direction, c.close(), swing.price(), c.openTs(), previous);
    }

    @Override
    protected List<StructureBreak> refreshPatterns(List<StructureBreak> current, List<Candle> candles,
                                                   double currentPrice, TimeframeConfig config) {
        return current;
    }

    @Override
    public void clear() {
        super.clear();
        swingHighs.clear();
        swingLows.clear();
        brokenSwings.clear();
        lastProcessedTs = Long.MIN_VALUE;
        trend = TrendDirection.RANGING;
    }

    public TrendDirection currentTrend() {
        return trend;
    }

    /**
     * Breaks filtered by type and/or direction (null matches any).
     */
    public List<StructureBreak> getBreaks(BreakType type, PatternDirection direction) {
        return get(b -> (type == null || b.type() == type) && (direction == null || b.direction() == direction));
    }

    public Optional<StructureBreak> getLast(BreakType type) {
        List<StructureBreak> breaks = getBreaks(type, null);
        return breaks.isEmpty() ? Optional.empty() : Optional.of(breaks.get(breaks.size() - 1));
    }

    public List<Pivot> getSwingHighs() {
        return List.copyOf(swingHighs.values());
    }

    public List<Pivot> getSwingLows() {
        return List.copyOf(swingLows.values());
    }
}

package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.LiquidityLevel;
import in.liqmap.domain.pattern.LiquidityLevel.LevelType;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneSide;
import in.liqmap.domain.zone.ZoneStrength;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Buy-side (equal highs) and sell-side (equal lows) liquidity levels.
 *
 * Highs (lows) within {@value #TOUCH_TOLERANCE} of each other are clustered greedily; a cluster
 * with at least {@value #MIN_TOUCHES} touches becomes a level at the average price. A level is
 * swept when a later wick penetrates it by the configured sweep penetration.
 */
public final class LiquidityLevelPlugin extends AbstractLiquidityPlugin<LiquidityLevel> {
    public static final String NAME = "liquidity_level";

    static final double TOUCH_TOLERANCE = 0.001;
    static final int MIN_TOUCHES = 2;
    static final int MIN_CANDLES = 5;
    static final int UPDATE_WINDOW = 10;
    static final int STALE_AFTER_CANDLES = 500;
    static final int MAX_LEVELS = 500;

    public LiquidityLevelPlugin(String symbol, Timeframe timeframe) {
        super(symbol, timeframe, MAX_LEVELS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(LiquidityLevel pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(LiquidityLevel pattern) {
        return !pattern.swept();
    }

    @Override
    protected List<LiquidityLevel> findPatterns(List<Candle> candles, TimeframeConfig config) {
        if (candles.size() < MIN_CANDLES) {
            return List.of();
        }
        List<LiquidityLevel> found = new ArrayList<>();
        found.addAll(cluster(candles, LevelType.BSL));
        found.addAll(cluster(candles, LevelType.SSL));
        return found;
    }

    private List<LiquidityLevel> cluster(List<Candle> candles, LevelType type) {
        int n = candles.size();
        boolean[] used = new boolean[n];
        List<LiquidityLevel> levels = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            if (used[i]) {
                continue;
            }
            double anchor = extreme(candles.get(i), type);
            List<Integer> members = new ArrayList<>();
            members.add(i);
            for (int j = i + 1; j < n; j++) {
                if (!used[j] && Math.abs(extreme(candles.get(j), type) - anchor) <= anchor * TOUCH_TOLERANCE) {
                    members.add(j);
                }
            }
            if (members.size() < MIN_TOUCHES) {
                continue;
            }

            double sum = 0.0;
            List<Long> touches = new ArrayList<>(members.size());
            for (int idx : members) {
                used[idx] = true;
                sum += extreme(candles.get(idx), type);
                touches.add(candles.get(idx).openTs());
            }
            double price = sum / members.size();
            if (hasLiveLevelNear(type, price)) {
                continue;
            }
            String id = idPrefix() + type.name().toLowerCase() + "_" + touches.get(0);
            levels.add(LiquidityLevel.detected(id, timeframe, type, price, touches));
        }
        return levels;
    }

    private boolean hasLiveLevelNear(LevelType type, double price) {
        for (LiquidityLevel level : getAll()) {
            if (!level.swept() && level.type() == type
                && Math.abs(level.price() - price) <= level.price() * TOUCH_TOLERANCE) {
                return true;
            }
        }
        return false;
    }

    private static double extreme(Candle c, LevelType type) {
        return type == LevelType.BSL ? c.high() : c.low();
    }

    @Override
    protected List<LiquidityLevel> refreshPatterns(List<LiquidityLevel> current, List<Candle> candles,
                                                   double currentPrice, TimeframeConfig config) {
        List<Candle> recent = tail(candles, UPDATE_WINDOW);
        long latestTs = candles.get(candles.size() - 1).openTs();
        long interval = timeframe.getIntervalSeconds();
        double penetration = config.sweepPenetrationPct();

        List<LiquidityLevel> refreshed = new ArrayList<>(current.size());
        for (LiquidityLevel level : current) {
            if (level.swept()) {
                refreshed.add(level);
                continue;
            }
            LiquidityLevel result = refresh(level, recent, penetration);
            if (!result.swept() && (latestTs - result.createdTs()) / interval >= STALE_AFTER_CANDLES) {
                continue;
            }
            refreshed.add(result);
        }
        return refreshed;
    }

    private static LiquidityLevel refresh(LiquidityLevel level, List<Candle> recent, double penetration) {
        LiquidityLevel result = level;
        for (Candle c : recent) {
            long lastTouch = result.touchTimestamps().get(result.touchCount() - 1);
            if (c.openTs() <= lastTouch) {
                continue;
            }
            double price = result.price();
            if (result.type() == LevelType.BSL && c.high() > price * (1 + penetration)) {
                return result.sweptAt(c.openTs(), c.high());
            }
            if (result.type() == LevelType.SSL && c.low() < price * (1 - penetration)) {
                return result.sweptAt(c.openTs(), c.low());
            }
            double wick = result.type() == LevelType.BSL ? c.high() : c.low();
            if (Math.abs(wick - price) <= price * TOUCH_TOLERANCE) {
                result = result.withTouch(c.openTs());
            }
        }
        return result;
    }

    @Override
    public Optional<LiquidityZone> toZone(LiquidityLevel pattern, TimeframeConfig config) {
        if (pattern.swept()) {
            return Optional.empty();
        }
        double pad = pattern.price() * config.zoneBufferPct();
        ZoneSide side = pattern.type() == LevelType.BSL ? ZoneSide.RESISTANCE : ZoneSide.SUPPORT;
        ZoneStrength strength = pattern.touchCount() >= 3 ? ZoneStrength.STRONG : ZoneStrength.MODERATE;
        return Optional.of(LiquidityZone.of(pattern.id(), timeframe, ZoneKind.LIQUIDITY_LEVEL, side,
            pattern.price() - pad, pattern.price() + pad, pattern.createdTs(), strength, 0.0)
            .withTouchCount(pattern.touchCount()));
    }

    /**
     * Unswept levels, optionally of one type.
     */
    public List<LiquidityLevel> getUnswept(LevelType type) {
        return get(l -> !l.swept() && (type == null || l.type() == type));
    }

    /**
     * Most recently swept levels, newest first.
     */
    public List<LiquidityLevel> getRecentSweeps(int limit) {
        List<LiquidityLevel> swept = get(LiquidityLevel::swept);
        swept.sort(Comparator.comparingLong(LiquidityLevel::sweepTs).reversed());
        return swept.size() > limit ? swept.subList(0, limit) : swept;
    }
}

package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.OrderBlock;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneStrength;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Order block detection.
 *
 * An impulse candle has a body above {@value #IMPULSE_BODY_MULTIPLIER}x the average body of the
 * scan window. The order block is the last opposite-coloured candle within
 * {@value #MAX_BLOCK_DISTANCE} candles before the impulse. Strength scales with the impulse's
 * relative move.
 *
 * Update: the first candle trading back into the block mitigates it, later ones count as
 * additional tests. A close through the far side turns the block into a breaker.
 */
public final class OrderBlockPlugin extends AbstractLiquidityPlugin<OrderBlock> {
    public static final String NAME = "order_block";

    static final int MIN_CANDLES = 20;
    static final int SCAN_WINDOW = 100;
    static final double IMPULSE_BODY_MULTIPLIER = 1.5;
    static final int MAX_BLOCK_DISTANCE = 10;
    static final int SKIP_AFTER_IMPULSE = 5;
    static final int UPDATE_WINDOW = 20;
    static final int MAX_BLOCKS = 100;

    public OrderBlockPlugin(String symbol, Timeframe timeframe) {
        super(symbol, timeframe, MAX_BLOCKS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(OrderBlock pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(OrderBlock pattern) {
        return pattern.isActive();
    }

    @Override
    protected List<OrderBlock> findPatterns(List<Candle> candles, TimeframeConfig config) {
        if (candles.size() < MIN_CANDLES) {
            return List.of();
        }

        List<Candle> recent = tail(candles, SCAN_WINDOW);
        double avgBody = 0.0;
        for (Candle c : recent) {
            avgBody += c.bodySize();
        }
        avgBody /= recent.size();
        double threshold = avgBody * IMPULSE_BODY_MULTIPLIER;

        List<OrderBlock> found = new ArrayList<>();
        int i = 1;
        while (i < recent.size() - 1) {
            Candle impulse = recent.get(i);
            if (impulse.bodySize() > threshold && impulse.open() > 0) {
                OrderBlock block = findBlockBefore(recent, i, impulse);
                if (block != null) {
                    found.add(block);
                    i += SKIP_AFTER_IMPULSE;
                }
            }
            i++;
        }
        return found;
    }

    private OrderBlock findBlockBefore(List<Candle> recent, int impulseIndex, Candle impulse) {
        boolean bullishImpulse = impulse.isBullish();
        boolean bearishImpulse = impulse.isBearish();
        if (!bullishImpulse && !bearishImpulse) {
            return null;
        }

        int lowest = Math.max(0, impulseIndex - MAX_BLOCK_DISTANCE);
        for (int j = impulseIndex - 1; j > lowest; j--) {
            Candle prev = recent.get(j);
            if (bullishImpulse && prev.isBearish()) {
                return block(prev, impulse, PatternDirection.BULLISH);
            }
            if (bearishImpulse && prev.isBullish()) {
                return block(prev, impulse, PatternDirection.BEARISH);
            }
        }
        return null;
    }

    private OrderBlock block(Candle origin, Candle impulse, PatternDirection direction) {
        double move = Math.abs((impulse.close() - impulse.open()) / impulse.open());
        ZoneStrength strength = ZoneStrength.fromScore(Math.min(move * 50.0, 1.0));
        String id = idPrefix() + "ob_" + (direction == PatternDirection.BULLISH ? "bull_" : "bear_") + origin.openTs();
        return OrderBlock.detected(id, timeframe, direction, origin.high(), origin.low(),
            origin.openTs(), impulse.openTs(), origin.volume(), strength);
    }

    @Override
    protected List<OrderBlock> refreshPatterns(List<OrderBlock> current, List<Candle> candles,
                                               double currentPrice, TimeframeConfig config) {
        List<Candle> recent = tail(candles, UPDATE_WINDOW);
        List<OrderBlock> refreshed = new ArrayList<>(current.size());
        for (OrderBlock ob : current) {
            refreshed.add(refresh(ob, recent));
        }
        return refreshed;
    }

    private static OrderBlock refresh(OrderBlock ob, List<Candle> recent) {
        if (ob.breaker()) {
            return ob;
        }
        OrderBlock result = ob;
        for (Candle c : recent) {
            if (c.openTs() <= result.impulseTs()
                || (result.lastTestTs() != null && c.openTs() <= result.lastTestTs())) {
                continue;
            }

            boolean bullish = result.direction() == PatternDirection.BULLISH;
            if (bullish ? c.close() < result.priceLow() : c.close() > result.priceHigh()) {
                return result.broken();
            }

            double wick = bullish ? c.low() : c.high();
            if (wick >= result.priceLow() && wick <= result.priceHigh()) {
                result = result.tested(c.openTs());
            }
        }
        return result;
    }

    @Override
    protected List<OrderBlock> retain(List<OrderBlock> all) {
        if (all.size() <= MAX_BLOCKS) {
            return all;
        }
        List<OrderBlock> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparing(OrderBlock::mitigated)
            .thenComparing(Comparator.comparingLong(OrderBlock::createdTs).reversed()));
        return sorted.subList(0, MAX_BLOCKS);
    }

    @Override
    public Optional<LiquidityZone> toZone(OrderBlock pattern, TimeframeConfig config) {
        if (!pattern.isActive()) {
            return Optional.empty();
        }
        return Optional.of(LiquidityZone.of(pattern.id(), timeframe, ZoneKind.ORDER_BLOCK,
            pattern.direction().side(), pattern.priceLow(), pattern.priceHigh(),
            pattern.createdTs(), pattern.strength(), pattern.volume()));
    }

    /**
     * Unmitigated, unbroken blocks, optionally of one direction, newest first.
     */
    public List<OrderBlock> getActive(PatternDirection direction) {
        List<OrderBlock> result = get(ob -> ob.isActive() && (direction == null || ob.direction() == direction));
        result.sort(Comparator.comparingLong(OrderBlock::createdTs).reversed());
        return result;
    }

    /**
     * Blocks that price has closed through.
     */
    public List<OrderBlock> getBreakers() {
        return get(OrderBlock::breaker);
    }

    /**
     * Nearest active block by midpoint distance.
     */
    public Optional<OrderBlock> getNearest(double price, SearchDirection direction) {
        return getActive(null).stream()
            .filter(ob -> switch (direction) {
                case ABOVE -> ob.priceLow() > price;
                case BELOW -> ob.priceHigh() < price;
                case BOTH -> true;
            })
            .min(Comparator.comparingDouble(ob -> Math.abs(ob.midpoint() - price)));
    }
}

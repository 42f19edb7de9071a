package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.BreakerBlock;
import in.liqmap.domain.pattern.OrderBlock;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Breaker blocks: order blocks that price closed through, with flipped polarity.
 *
 * Reads broken blocks from the {@link OrderBlockPlugin} of the same symbol/timeframe and never
 * changes them. A breaker is tested when price trades back into it and invalidated when price
 * closes through it again.
 */
public final class BreakerBlockPlugin extends AbstractLiquidityPlugin<BreakerBlock> {
    public static final String NAME = "breaker_block";

    static final int UPDATE_WINDOW = 20;
    static final int MAX_BREAKERS = 100;

    private final OrderBlockPlugin orderBlocks;

    public BreakerBlockPlugin(String symbol, Timeframe timeframe, OrderBlockPlugin orderBlocks) {
        super(symbol, timeframe, MAX_BREAKERS);
        this.orderBlocks = Objects.requireNonNull(orderBlocks, "orderBlocks");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String idOf(BreakerBlock pattern) {
        return pattern.id();
    }

    @Override
    protected boolean isActive(BreakerBlock pattern) {
        return !pattern.invalidated();
    }

    @Override
    protected List<BreakerBlock> findPatterns(List<Candle> candles, TimeframeConfig config) {
        long breakTs = candles.get(candles.size() - 1).openTs();
        List<BreakerBlock> found = new ArrayList<>();
        for (OrderBlock ob : orderBlocks.getBreakers()) {
            found.add(BreakerBlock.fromBrokenOrderBlock(idPrefix() + "breaker_" + ob.createdTs(), ob, breakTs));
        }
        return found;
    }

    @Override
    protected List<BreakerBlock> refreshPatterns(List<BreakerBlock> current, List<Candle> candles,
                                                 double currentPrice, TimeframeConfig config) {
        List<Candle> recent = tail(candles, UPDATE_WINDOW);
        List<BreakerBlock> refreshed = new ArrayList<>(current.size());
        for (BreakerBlock bb : current) {
            refreshed.add(bb.invalidated() ? bb : refresh(bb, recent));
        }
        return refreshed;
    }

    private static BreakerBlock refresh(BreakerBlock bb, List<Candle> recent) {
        BreakerBlock result = bb;
        for (Candle c : recent) {
            if (c.openTs() <= result.breakTs()
                || (result.lastTestTs() != null && c.openTs() <= result.lastTestTs())) {
                continue;
            }
            boolean bullish = result.direction() == PatternDirection.BULLISH;
            if (bullish ? c.close() < result.priceLow() : c.close() > result.priceHigh()) {
                return result.invalidate();
            }
            if (c.low() <= result.priceHigh() && c.high() >= result.priceLow()) {
                result = result.tested(c.openTs());
            }
        }
        return result;
    }

    @Override
    protected List<BreakerBlock> retain(List<BreakerBlock> all) {
        if (all.size() <= MAX_BREAKERS) {
            return all;
        }
        List<BreakerBlock> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparing(BreakerBlock::invalidated)
            .thenComparing(Comparator.comparingLong(BreakerBlock::breakTs).reversed()));
        return sorted.subList(0, MAX_BREAKERS);
    }

    @Override
    public Optional<LiquidityZone> toZone(BreakerBlock pattern, TimeframeConfig config) {
        if (pattern.invalidated()) {
            return Optional.empty();
        }
        return Optional.of(LiquidityZone.of(pattern.id(), timeframe, ZoneKind.BREAKER_BLOCK,
            pattern.direction().side(), pattern.priceLow(), pattern.priceHigh(), pattern.createdTs(),
            pattern.strength(), 0.0));
    }

    /**
     * Live breakers, optionally of one direction.
     */
    public List<BreakerBlock> getActive(PatternDirection direction) {
        return get(bb -> !bb.invalidated() && (direction == null || bb.direction() == direction));
    }
}

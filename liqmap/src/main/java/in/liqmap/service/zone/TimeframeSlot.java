package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.Displacement;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.PremiumDiscount;
import in.liqmap.service.plugin.BreakerBlockPlugin;
import in.liqmap.service.plugin.FairValueGapPlugin;
import in.liqmap.service.plugin.LiquidityLevelPlugin;
import in.liqmap.service.plugin.LiquidityPlugin;
import in.liqmap.service.plugin.LiquiditySweepPlugin;
import in.liqmap.service.plugin.OrderBlockPlugin;
import in.liqmap.service.plugin.StructureBreakPlugin;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Zone set, plugins and refresh lock of one timeframe.
 *
 * Plugins are registered in dependency order: order blocks before breakers, liquidity levels
 * before sweeps. Writers hold {@link #lock}; {@link #zones} is swapped as an immutable list so
 * single-timeframe reads need no lock.
 */
final class TimeframeSlot {
    final Timeframe timeframe;
    final TimeframeConfig config;
    final ReentrantLock lock = new ReentrantLock();
    final Map<String, LiquidityPlugin<?>> plugins = new LinkedHashMap<>();

    // candidate id -> createdTs, for every candidate already evaluated
    final Map<String, Long> seenCandidates = new HashMap<>();

    volatile List<LiquidityZone> zones = List.of();
    volatile List<Displacement> displacements = List.of();
    volatile PremiumDiscount range;
    long lastTouchTs = Long.MIN_VALUE;

    TimeframeSlot(String symbol, Timeframe timeframe, TimeframeConfig config) {
        this.timeframe = timeframe;
        this.config = config;

        OrderBlockPlugin orderBlocks = new OrderBlockPlugin(symbol, timeframe);
        LiquidityLevelPlugin levels = new LiquidityLevelPlugin(symbol, timeframe);
        register(orderBlocks);
        register(new FairValueGapPlugin(symbol, timeframe));
        register(levels);
        register(new StructureBreakPlugin(symbol, timeframe));
        register(new BreakerBlockPlugin(symbol, timeframe, orderBlocks));
        register(new LiquiditySweepPlugin(symbol, timeframe, levels));
    }

    private void register(LiquidityPlugin<?> plugin) {
        plugins.put(plugin.name(), plugin);
    }

    <P extends LiquidityPlugin<?>> P plugin(Class<P> type) {
        for (LiquidityPlugin<?> p : plugins.values()) {
            if (type.isInstance(p)) {
                return type.cast(p);
            }
        }
        throw new IllegalArgumentException("No plugin of type " + type.getSimpleName());
    }

    void reset() {
        zones = List.of();
        displacements = List.of();
        range = null;
        seenCandidates.clear();
        lastTouchTs = Long.MIN_VALUE;
        for (LiquidityPlugin<?> p : plugins.values()) {
            p.clear();
        }
    }
}

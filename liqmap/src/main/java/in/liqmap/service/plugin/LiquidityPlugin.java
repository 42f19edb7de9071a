package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.zone.LiquidityZone;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One price-action pattern type for one symbol/timeframe.
 *
 * Lifecycle per refresh: {@link #detect} finds and stores new patterns, {@link #update} refreshes
 * the state of stored ones (touches, mitigation, invalidation) against the latest candles,
 * {@link #get} queries them. Returned patterns are immutable.
 *
 * @param <T> pattern record type
 */
public interface LiquidityPlugin<T> {

    /**
     * Stable plugin name used for enable/disable and status.
     */
    String name();

    /**
     * Detect patterns in the candle window and store the ones not seen before.
     *
     * @return only the newly stored patterns; empty when disabled
     */
    List<T> detect(List<Candle> candles, TimeframeConfig config);

    /**
     * Refresh stored patterns against the latest candles and price. No-op when disabled.
     */
    void update(List<Candle> candles, double currentPrice, TimeframeConfig config);

    /**
     * Stored patterns matching the filter.
     */
    List<T> get(Predicate<? super T> filter);

    /**
     * Zone view of a pattern, if this pattern type maps onto a price zone.
     */
    default Optional<LiquidityZone> toZone(T pattern, TimeframeConfig config) {
        return Optional.empty();
    }

    boolean isEnabled();

    void enable();

    void disable();

    /**
     * Drop all stored patterns.
     */
    void clear();

    PluginStatus status();
}

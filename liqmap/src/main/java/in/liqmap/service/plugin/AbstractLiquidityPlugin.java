package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Base plugin: enable flag, id-deduplicated storage and error isolation.
 *
 * Stored patterns live in an immutable list that is swapped on every change, so readers on
 * other threads always see a complete list. Writers (detect/update) are serialized by the
 * owning liquidity map's per-timeframe refresh.
 *
 * A subclass exception during detection or update is logged and the refresh continues without
 * that plugin's contribution.
 */
public abstract class AbstractLiquidityPlugin<T> implements LiquidityPlugin<T> {
    private static final Logger log = LoggerFactory.getLogger(AbstractLiquidityPlugin.class);

    protected final String symbol;
    protected final Timeframe timeframe;
    private final int maxPatterns;

    private volatile boolean enabled = true;
    private volatile List<T> patterns = List.of();

    protected AbstractLiquidityPlugin(String symbol, Timeframe timeframe, int maxPatterns) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe");
        this.maxPatterns = maxPatterns;
    }

    /**
     * Unique id of a pattern; repeated detections of the same id are ignored.
     */
    protected abstract String idOf(T pattern);

    /**
     * Scan the window for patterns. May return patterns already stored.
     */
    protected abstract List<T> findPatterns(List<Candle> candles, TimeframeConfig config);

    /**
     * Return the refreshed version of the stored patterns.
     */
    protected abstract List<T> refreshPatterns(List<T> current, List<Candle> candles, double currentPrice,
                                               TimeframeConfig config);

    /**
     * Whether a stored pattern still counts as live for status reporting.
     */
    protected abstract boolean isActive(T pattern);

    /**
     * Apply the storage cap. Default keeps the most recently added patterns.
     */
    protected List<T> retain(List<T> all) {
        if (all.size() <= maxPatterns) {
            return all;
        }
        return all.subList(all.size() - maxPatterns, all.size());
    }

    @Override
    public final List<T> detect(List<Candle> candles, TimeframeConfig config) {
        if (!enabled || candles == null || candles.isEmpty()) {
            return List.of();
        }

        List<T> found;
        try {
            found = findPatterns(candles, config);
        } catch (RuntimeException e) {
            log.error("[{}] {} {} detection failed: {}", name(), symbol, timeframe, e.getMessage(), e);
            return List.of();
        }

        List<T> current = patterns;
        Set<String> known = new HashSet<>();
        for (T p : current) {
            known.add(idOf(p));
        }
        List<T> fresh = new ArrayList<>();
        for (T p : found) {
            if (known.add(idOf(p))) {
                fresh.add(p);
            }
        }

        if (!fresh.isEmpty()) {
            List<T> merged = new ArrayList<>(current);
            merged.addAll(fresh);
            patterns = List.copyOf(retain(merged));
            log.debug("[{}] {} {} stored {} new pattern(s)", name(), symbol, timeframe, fresh.size());
        }
        return fresh;
    }

    @Override
    public final void update(List<Candle> candles, double currentPrice, TimeframeConfig config) {
        if (!enabled || candles == null || candles.isEmpty() || patterns.isEmpty()) {
            return;
        }
        try {
            List<T> refreshed = refreshPatterns(patterns, candles, currentPrice, config);
            patterns = List.copyOf(retain(new ArrayList<>(refreshed)));
        } catch (RuntimeException e) {
            log.error("[{}] {} {} update failed: {}", name(), symbol, timeframe, e.getMessage(), e);
        }
    }

    @Override
    public List<T> get(Predicate<? super T> filter) {
        List<T> result = new ArrayList<>();
        for (T p : patterns) {
            if (filter.test(p)) {
                result.add(p);
            }
        }
        return result;
    }

    public List<T> getAll() {
        return patterns;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void enable() {
        enabled = true;
        log.info("[{}] {} {} enabled", name(), symbol, timeframe);
    }

    @Override
    public void disable() {
        enabled = false;
        log.info("[{}] {} {} disabled", name(), symbol, timeframe);
    }

    @Override
    public void clear() {
        patterns = List.of();
    }

    @Override
    public PluginStatus status() {
        List<T> current = patterns;
        int active = 0;
        for (T p : current) {
            if (isActive(p)) {
                active++;
            }
        }
        return new PluginStatus(name(), enabled, current.size(), active);
    }

    protected String idPrefix() {
        return symbol + "_" + timeframe.getLabel() + "_";
    }

    /**
     * Last n candles (or all of them).
     */
    protected static List<Candle> tail(List<Candle> candles, int n) {
        return candles.size() > n ? candles.subList(candles.size() - n, candles.size()) : candles;
    }
}

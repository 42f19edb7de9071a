package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.config.TimeframeConfigService;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendDirection;
import in.liqmap.domain.data.TrendState;
import in.liqmap.domain.pattern.Displacement;
import in.liqmap.domain.pattern.FairValueGap;
import in.liqmap.domain.pattern.LiquiditySweep;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.ConfluenceZone;
import in.liqmap.domain.zone.FilterStage;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.PdPosition;
import in.liqmap.domain.zone.PremiumDiscount;
import in.liqmap.domain.zone.ZoneFilter;
import in.liqmap.domain.zone.ZoneSide;
import in.liqmap.infrastructure.metrics.ZoneMetrics;
import in.liqmap.service.indicator.ATRCalculator;
import in.liqmap.service.indicator.ATRCalculator.ATRResult;
import in.liqmap.service.indicator.DisplacementDetector;
import in.liqmap.service.indicator.VolumeAnalyzer;
import in.liqmap.service.plugin.FairValueGapPlugin;
import in.liqmap.service.plugin.LiquidityPlugin;
import in.liqmap.service.plugin.LiquiditySweepPlugin;
import in.liqmap.service.plugin.PluginStatus;
import in.liqmap.service.plugin.SearchDirection;
import in.liqmap.service.plugin.StructureBreakPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-symbol multi-timeframe liquidity map.
 *
 * Refresh pipeline for one timeframe, run on every closed candle:
 * <ol>
 *   <li>Volatility gate: ATR outside [atrMin, atrMax] x baseline skips detection.</li>
 *   <li>Trend adaptation of the timeframe config for this refresh only.</li>
 *   <li>Detection: pivot/volume support and resistance plus every enabled plugin.</li>
 *   <li>Volume spike filter on each candidate's origin candle.</li>
 *   <li>Distance filter against the current price.</li>
 *   <li>Age filter on the existing zone set.</li>
 *   <li>Merge of surviving candidates into the zone set.</li>
 *   <li>Plugin and zone state update against the latest candle.</li>
 *   <li>Strength re-rating of active zones by touches and volume.</li>
 * </ol>
 *
 * Every refresh, gated or not, also records the window's premium/discount range and its
 * displacement runs.
 *
 * Each timeframe refreshes under its own lock, so different timeframes refresh in parallel.
 * Queries return immutable zones; cross-timeframe queries lock every timeframe (in enum order)
 * to read all zone sets at the same instant.
 */
public final class LiquidityMap {
    private static final Logger log = LoggerFactory.getLogger(LiquidityMap.class);

    private final String symbol;
    private final ZoneMetrics metrics;
    private final Map<Timeframe, TimeframeSlot> slots = new EnumMap<>(Timeframe.class);
    private final ConfluenceCalculator confluence;
    private final DisplacementDetector displacementDetector = new DisplacementDetector();

    private final AtomicLong atrFiltered = new AtomicLong();
    private final AtomicLong volumeFiltered = new AtomicLong();
    private final AtomicLong distanceFiltered = new AtomicLong();
    private final AtomicLong ageFiltered = new AtomicLong();
    private final AtomicLong zonesCreated = new AtomicLong();

    public LiquidityMap(String symbol, TimeframeConfigService configService, ZoneMetrics metrics) {
        this(symbol, configService, EnumSet.allOf(Timeframe.class), metrics);
    }

    public LiquidityMap(String symbol, TimeframeConfigService configService, Set<Timeframe> timeframes,
                        ZoneMetrics metrics) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(configService, "configService");
        if (timeframes.isEmpty()) {
            throw new IllegalArgumentException("At least one timeframe required");
        }
        this.metrics = metrics;

        Map<Timeframe, TimeframeConfig> configs = new EnumMap<>(Timeframe.class);
        for (Timeframe tf : timeframes) {
            TimeframeConfig config = configService.getConfig(tf);
            configs.put(tf, config);
            slots.put(tf, new TimeframeSlot(symbol, tf, config));
        }
        this.confluence = new ConfluenceCalculator(configs);
        log.info("[LIQMAP] {} tracking timeframes {}", symbol, slots.keySet());
    }

    public String getSymbol() {
        return symbol;
    }

    public Set<Timeframe> getTimeframes() {
        return EnumSet.copyOf(slots.keySet());
    }

    public RefreshResult onCandleClose(Timeframe timeframe, List<Candle> candles, double currentPrice) {
        return onCandleClose(timeframe, candles, currentPrice, null);
    }

    /**
     * Refresh one timeframe.
     *
     * @param candles      candle window, oldest first; the last candle is the one that just closed
     * @param currentPrice latest traded price
     * @param trend        trend reading used to adapt parameters, or null
     * @return what the refresh did; rejected refreshes leave the zone set untouched
     */
    public RefreshResult onCandleClose(Timeframe timeframe, List<Candle> candles, double currentPrice,
                                       TrendState trend) {
        TimeframeSlot slot = slots.get(timeframe);
        if (slot == null) {
            throw new IllegalArgumentException("Timeframe " + timeframe + " not tracked for " + symbol);
        }
        if (candles == null || candles.isEmpty()) {
            return RefreshResult.rejected(timeframe, "no candles", slot.zones.size());
        }
        if (!(currentPrice > 0.0) || Double.isInfinite(currentPrice)) {
            log.warn("[LIQMAP] {} {} refresh rejected, invalid price {}", symbol, timeframe, currentPrice);
            return RefreshResult.rejected(timeframe, "invalid price", slot.zones.size());
        }

        TimeframeConfig config = slot.config;
        List<Candle> window = candles.size() > config.lookbackCandles()
            ? List.copyOf(candles.subList(candles.size() - config.lookbackCandles(), candles.size()))
            : List.copyOf(candles);
        if (window.size() < config.pivotLeft() + config.pivotRight() + 1) {
            return RefreshResult.rejected(timeframe, "insufficient candles", slot.zones.size());
        }

        slot.lock.lock();
        try {
            return refresh(slot, window, currentPrice, trend);
        } finally {
            slot.lock.unlock();
        }
    }

    private RefreshResult refresh(TimeframeSlot slot, List<Candle> window, double price, TrendState trend) {
        Timeframe tf = slot.timeframe;
        TimeframeConfig config = slot.config;
        Candle latest = window.get(window.size() - 1);
        long currentTs = latest.openTs();

        ATRResult volatility = ATRCalculator.assess(window, ATRCalculator.DEFAULT_PERIOD,
            config.atrMinMultiplier(), config.atrMaxMultiplier());
        boolean gated = volatility.isExtreme();
        TimeframeConfig active = gated ? config : TrendAdapter.adapt(config, trend);

        int detected = 0;
        List<LiquidityZone> candidates = List.of();
        if (gated) {
            atrFiltered.incrementAndGet();
            recordFiltered(tf, FilterStage.ATR, 1);
            log.debug("[LIQMAP] {} {} detection skipped: {}", symbol, tf, volatility.getSummary());
        } else {
            List<LiquidityZone> raw = detect(slot, window, active);
            detected = raw.size();
            candidates = unseen(slot, raw, currentTs);
            candidates = filterByVolume(tf, window, candidates, active);
            candidates = filterByDistance(tf, candidates, price, active);
        }

        List<LiquidityZone> zones = new ArrayList<>();
        int aged = 0;
        for (LiquidityZone z : slot.zones) {
            if (z.ageInCandles(currentTs) > config.maxZoneAgeCandles()) {
                aged++;
            } else {
                zones.add(z);
            }
        }
        if (aged > 0) {
            ageFiltered.addAndGet(aged);
            recordFiltered(tf, FilterStage.AGE, aged);
        }
        pruneSeen(slot, currentTs);

        int created = 0;
        int merged = 0;
        if (!candidates.isEmpty()) {
            ZoneMerger.MergeResult result = ZoneMerger.merge(zones, candidates, config.mergeRadiusPct());
            zones = result.zones();
            created = result.added();
            merged = result.merged();
            if (created > 0) {
                zonesCreated.addAndGet(created);
                if (metrics != null) {
                    metrics.recordZonesCreated(symbol, tf, created);
                }
            }
        }

        zones = applyLatestCandle(slot, zones, latest);
        zones = ZoneStrengthRater.rate(zones);
        for (LiquidityPlugin<?> plugin : slot.plugins.values()) {
            plugin.update(window, price, active);
        }

        slot.zones = List.copyOf(zones);
        slot.displacements = displacementDetector.detect(window);
        slot.range = windowRange(tf, window);
        if (metrics != null) {
            metrics.setActiveZones(symbol, tf, zones.size());
        }

        if (created > 0 || aged > 0) {
            log.info("[LIQMAP] {} {} zones={} (+{} created, {} merged, -{} aged)",
                symbol, tf, zones.size(), created, merged, aged);
        }
        return new RefreshResult(tf, gated ? "volatility " + volatility.volatility() : null,
            volatility.volatility(), detected, created, merged, aged, zones.size());
    }

    private List<LiquidityZone> detect(TimeframeSlot slot, List<Candle> window, TimeframeConfig config) {
        List<LiquidityZone> candidates = new ArrayList<>(
            ZoneCandidateFactory.supportResistance(symbol, slot.timeframe, window, config));
        for (LiquidityPlugin<?> plugin : slot.plugins.values()) {
            candidates.addAll(pluginZones(plugin, slot.timeframe, window, config));
        }
        return candidates;
    }

    /**
     * Zone view of a plugin's new patterns. A pattern whose zone cannot be built is skipped.
     */
    private <T> List<LiquidityZone> pluginZones(LiquidityPlugin<T> plugin, Timeframe tf, List<Candle> window,
                                                TimeframeConfig config) {
        List<LiquidityZone> zones = new ArrayList<>();
        for (T pattern : plugin.detect(window, config)) {
            try {
                plugin.toZone(pattern, config).ifPresent(zones::add);
            } catch (RuntimeException e) {
                log.error("[LIQMAP] {} {} {} pattern skipped, no zone: {}",
                    symbol, tf, plugin.name(), e.getMessage(), e);
            }
        }
        return zones;
    }

    /**
     * Drop candidates already evaluated, already in the zone set or already too old, and remember
     * the rest so a pivot re-detected on later refreshes is not counted again.
     */
    private List<LiquidityZone> unseen(TimeframeSlot slot, List<LiquidityZone> raw, long currentTs) {
        Set<String> present = new HashSet<>();
        for (LiquidityZone z : slot.zones) {
            present.add(z.id());
        }
        List<LiquidityZone> result = new ArrayList<>();
        for (LiquidityZone c : raw) {
            if (present.contains(c.id()) || slot.seenCandidates.containsKey(c.id())) {
                continue;
            }
            slot.seenCandidates.put(c.id(), c.createdTs());
            if (c.ageInCandles(currentTs) <= slot.config.maxZoneAgeCandles()) {
                result.add(c);
            }
        }
        return result;
    }

    private void pruneSeen(TimeframeSlot slot, long currentTs) {
        long interval = slot.timeframe.getIntervalSeconds();
        slot.seenCandidates.values().removeIf(
            createdTs -> (currentTs - createdTs) / interval > slot.config.maxZoneAgeCandles());
    }

    private List<LiquidityZone> filterByVolume(Timeframe tf, List<Candle> window, List<LiquidityZone> candidates,
                                               TimeframeConfig config) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        Map<Long, Integer> indexByTs = new HashMap<>();
        for (int i = 0; i < window.size(); i++) {
            indexByTs.put(window.get(i).openTs(), i);
        }

        List<LiquidityZone> kept = new ArrayList<>();
        int dropped = 0;
        for (LiquidityZone c : candidates) {
            Integer idx = indexByTs.get(c.createdTs());
            if (idx == null || idx == 0) {
                kept.add(c);
                continue;
            }
            Double ratio = VolumeAnalyzer.spikeRatio(window, idx, VolumeAnalyzer.DEFAULT_WINDOW);
            if (ratio == null || ratio < config.volumeSpikeMultiplier()) {
                dropped++;
            } else {
                kept.add(c);
            }
        }
        if (dropped > 0) {
            volumeFiltered.addAndGet(dropped);
            recordFiltered(tf, FilterStage.VOLUME, dropped);
        }
        return kept;
    }

    private List<LiquidityZone> filterByDistance(Timeframe tf, List<LiquidityZone> candidates, double price,
                                                 TimeframeConfig config) {
        List<LiquidityZone> kept = new ArrayList<>();
        int dropped = 0;
        for (LiquidityZone c : candidates) {
            if (Math.abs(c.midpoint() - price) / price < config.minZoneDistancePct()) {
                dropped++;
            } else {
                kept.add(c);
            }
        }
        if (dropped > 0) {
            distanceFiltered.addAndGet(dropped);
            recordFiltered(tf, FilterStage.DISTANCE, dropped);
        }
        return kept;
    }

    /**
     * Count a touch for zones the latest candle trades into; mark zones it closes through as
     * mitigated. Candles within one interval of a zone's origin belong to the pattern itself.
     */
    private static List<LiquidityZone> applyLatestCandle(TimeframeSlot slot, List<LiquidityZone> zones, Candle latest) {
        if (latest.openTs() <= slot.lastTouchTs) {
            return zones;
        }
        slot.lastTouchTs = latest.openTs();
        long interval = slot.timeframe.getIntervalSeconds();

        List<LiquidityZone> updated = new ArrayList<>(zones.size());
        for (LiquidityZone z : zones) {
            if (z.mitigated() || latest.openTs() <= z.createdTs() + interval) {
                updated.add(z);
                continue;
            }
            boolean closedThrough = z.side() == ZoneSide.SUPPORT
                ? latest.close() < z.priceLow()
                : latest.close() > z.priceHigh();
            if (closedThrough) {
                updated.add(z.withMitigated(true));
            } else if (latest.low() <= z.priceHigh() && latest.high() >= z.priceLow()) {
                updated.add(z.withTouchCount(z.touchCount() + 1));
            } else {
                updated.add(z);
            }
        }
        return updated;
    }

    private static PremiumDiscount windowRange(Timeframe tf, List<Candle> window) {
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (Candle c : window) {
            high = Math.max(high, c.high());
            low = Math.min(low, c.low());
        }
        return new PremiumDiscount(tf, low, high);
    }

    private void recordFiltered(Timeframe tf, FilterStage stage, int count) {
        if (metrics != null) {
            metrics.recordFiltered(symbol, tf, stage, count);
        }
    }

    // ---------------------------------------------------------------- queries

    /**
     * Zones of one timeframe matching the filter.
     */
    public List<LiquidityZone> getZones(Timeframe timeframe, ZoneFilter filter) {
        TimeframeSlot slot = slot(timeframe);
        List<LiquidityZone> result = new ArrayList<>();
        for (LiquidityZone z : slot.zones) {
            if (filter.matches(z)) {
                result.add(z);
            }
        }
        return result;
    }

    /**
     * Zones of all timeframes matching the filter, read at the same instant.
     */
    public Map<Timeframe, List<LiquidityZone>> getAllZones(ZoneFilter filter) {
        Map<Timeframe, List<LiquidityZone>> snapshot = snapshot();
        Map<Timeframe, List<LiquidityZone>> result = new EnumMap<>(Timeframe.class);
        for (Map.Entry<Timeframe, List<LiquidityZone>> e : snapshot.entrySet()) {
            List<LiquidityZone> matching = new ArrayList<>();
            for (LiquidityZone z : e.getValue()) {
                if (filter.matches(z)) {
                    matching.add(z);
                }
            }
            result.put(e.getKey(), matching);
        }
        return result;
    }

    /**
     * Representatives of confluence groups, each carrying its group's confluence weight.
     */
    public List<LiquidityZone> getConfluenceZones(int minDistinctTimeframes) {
        List<LiquidityZone> result = new ArrayList<>();
        for (ConfluenceZone group : getConfluenceGroups(minDistinctTimeframes)) {
            result.add(group.representative());
        }
        return result;
    }

    /**
     * Confluence groups over active zones of all timeframes.
     */
    public List<ConfluenceZone> getConfluenceGroups(int minDistinctTimeframes) {
        return confluence.calculate(getAllZones(ZoneFilter.active()), minDistinctTimeframes);
    }

    /**
     * Closest active support zone whose midpoint is at or below price.
     */
    public Optional<LiquidityZone> getNearestSupport(Timeframe timeframe, double price) {
        return getZones(timeframe, ZoneFilter.builder().side(ZoneSide.SUPPORT).build()).stream()
            .filter(z -> z.midpoint() <= price)
            .max(Comparator.comparingDouble(LiquidityZone::midpoint));
    }

    /**
     * Closest active resistance zone whose midpoint is at or above price.
     */
    public Optional<LiquidityZone> getNearestResistance(Timeframe timeframe, double price) {
        return getZones(timeframe, ZoneFilter.builder().side(ZoneSide.RESISTANCE).build()).stream()
            .filter(z -> z.midpoint() >= price)
            .min(Comparator.comparingDouble(LiquidityZone::midpoint));
    }

    public List<FairValueGap> getFairValueGaps(Timeframe timeframe, boolean unfilledOnly) {
        FairValueGapPlugin fvg = slot(timeframe).plugin(FairValueGapPlugin.class);
        return unfilledOnly ? fvg.getUnfilled(null) : fvg.get(g -> true);
    }

    public Optional<FairValueGap> getNearestFairValueGap(Timeframe timeframe, double price) {
        return getNearestFairValueGap(timeframe, price, SearchDirection.BOTH);
    }

    public Optional<FairValueGap> getNearestFairValueGap(Timeframe timeframe, double price, SearchDirection direction) {
        return slot(timeframe).plugin(FairValueGapPlugin.class).getNearest(price, direction);
    }

    /**
     * Trend according to the last structure break on this timeframe.
     */
    public TrendDirection getStructureTrend(Timeframe timeframe) {
        return slot(timeframe).plugin(StructureBreakPlugin.class).currentTrend();
    }

    public List<LiquiditySweep> getLiquiditySweeps(Timeframe timeframe, boolean confirmedOnly) {
        return slot(timeframe).plugin(LiquiditySweepPlugin.class).getSweeps(null, confirmedOnly, null);
    }

    /**
     * Displacement runs found in the last refresh window, newest first.
     *
     * @param timeframe  timeframe to read, or null for all tracked timeframes
     * @param direction  direction to keep, or null for both
     * @param minCandles minimum run length
     */
    public List<Displacement> getDisplacements(Timeframe timeframe, PatternDirection direction, int minCandles) {
        Collection<TimeframeSlot> source = timeframe == null ? slots.values() : List.of(slot(timeframe));
        List<Displacement> result = new ArrayList<>();
        for (TimeframeSlot slot : source) {
            for (Displacement d : slot.displacements) {
                if ((direction == null || d.direction() == direction) && d.candleCount() >= minCandles) {
                    result.add(d);
                }
            }
        }
        result.sort(Comparator.comparingLong(Displacement::endTs).reversed());
        return result;
    }

    public List<Displacement> getRecentDisplacements(Timeframe timeframe, int limit) {
        List<Displacement> all = getDisplacements(timeframe, null, 0);
        return all.size() > limit ? List.copyOf(all.subList(0, Math.max(0, limit))) : all;
    }

    public Optional<Displacement> getStrongestDisplacement(Timeframe timeframe, DisplacementMetric metric) {
        Comparator<Displacement> order = switch (metric) {
            case MOVE_PCT -> Comparator.comparingDouble(Displacement::movePct);
            case VOLUME_SURGE -> Comparator.comparingDouble(Displacement::volumeSurgeRatio);
            case CANDLE_COUNT -> Comparator.comparingInt(Displacement::candleCount);
        };
        return getDisplacements(timeframe, null, 0).stream().max(order);
    }

    /**
     * High/low range of the last refresh window; empty before the first refresh.
     */
    public Optional<PremiumDiscount> getPremiumDiscount(Timeframe timeframe) {
        return Optional.ofNullable(slot(timeframe).range);
    }

    /**
     * Premium/discount position of a zone's midpoint within its timeframe's last window.
     */
    public Optional<PdPosition> getPdPosition(LiquidityZone zone) {
        return getPremiumDiscount(zone.timeframe()).map(pd -> pd.classify(zone.midpoint()));
    }

    /**
     * Typed access to a plugin for pattern-specific queries.
     */
    public <P extends LiquidityPlugin<?>> P getPlugin(Timeframe timeframe, Class<P> type) {
        return slot(timeframe).plugin(type);
    }

    public void enablePlugin(String name) {
        for (LiquidityPlugin<?> p : pluginsNamed(name)) {
            p.enable();
        }
    }

    public void disablePlugin(String name) {
        for (LiquidityPlugin<?> p : pluginsNamed(name)) {
            p.disable();
        }
    }

    private List<LiquidityPlugin<?>> pluginsNamed(String name) {
        List<LiquidityPlugin<?>> result = new ArrayList<>();
        for (TimeframeSlot slot : slots.values()) {
            LiquidityPlugin<?> p = slot.plugins.get(name);
            if (p != null) {
                result.add(p);
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("Unknown plugin: " + name);
        }
        return result;
    }

    public List<PluginStatus> getPluginStatus(Timeframe timeframe) {
        List<PluginStatus> result = new ArrayList<>();
        for (LiquidityPlugin<?> p : slot(timeframe).plugins.values()) {
            result.add(p.status());
        }
        return result;
    }

    public FilterStatistics getStatistics() {
        return new FilterStatistics(atrFiltered.get(), volumeFiltered.get(), distanceFiltered.get(),
            ageFiltered.get(), zonesCreated.get());
    }

    public void resetStatistics() {
        atrFiltered.set(0);
        volumeFiltered.set(0);
        distanceFiltered.set(0);
        ageFiltered.set(0);
        zonesCreated.set(0);
    }

    /**
     * Drop all zones and patterns of one timeframe.
     */
    public void clear(Timeframe timeframe) {
        TimeframeSlot slot = slot(timeframe);
        slot.lock.lock();
        try {
            slot.reset();
        } finally {
            slot.lock.unlock();
        }
        if (metrics != null) {
            metrics.setActiveZones(symbol, timeframe, 0);
        }
        log.info("[LIQMAP] {} {} cleared", symbol, timeframe);
    }

    private TimeframeSlot slot(Timeframe timeframe) {
        TimeframeSlot slot = slots.get(timeframe);
        if (slot == null) {
            throw new IllegalArgumentException("Timeframe " + timeframe + " not tracked for " + symbol);
        }
        return slot;
    }

    private Map<Timeframe, List<LiquidityZone>> snapshot() {
        Collection<TimeframeSlot> ordered = slots.values();
        for (TimeframeSlot slot : ordered) {
            slot.lock.lock();
        }
        try {
            Map<Timeframe, List<LiquidityZone>> result = new EnumMap<>(Timeframe.class);
            for (TimeframeSlot slot : ordered) {
                result.put(slot.timeframe, slot.zones);
            }
            return result;
        } finally {
            for (TimeframeSlot slot : ordered) {
                slot.lock.unlock();
            }
        }
    }
}

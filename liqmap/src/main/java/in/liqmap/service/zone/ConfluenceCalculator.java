package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.ConfluenceZone;
import in.liqmap.domain.zone.LiquidityZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multi-timeframe confluence over a snapshot of zone sets.
 *
 * Zones from all timeframes are sorted by midpoint and chained into groups: a zone joins the
 * current group when its midpoint lies within the merge radius of the previous zone's midpoint.
 * The radius is that of the highest-weight timeframe in the group so far.
 *
 * Group weight is the sum of tfWeight over the distinct timeframes present, so two M1 zones
 * count once. The representative is the member with the highest (tfWeight, strength, touch
 * count, volume); it is returned with its confluence weight set.
 */
public final class ConfluenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(ConfluenceCalculator.class);

    private final Map<Timeframe, TimeframeConfig> configs;

    public ConfluenceCalculator(Map<Timeframe, TimeframeConfig> configs) {
        this.configs = Map.copyOf(configs);
    }

    /**
     * Group zones across timeframes.
     *
     * @param zonesByTimeframe      zone sets taken at the same instant
     * @param minDistinctTimeframes minimum distinct timeframes per group (at least 1)
     * @return groups sorted by weight, then distinct timeframe count, descending
     */
    public List<ConfluenceZone> calculate(Map<Timeframe, List<LiquidityZone>> zonesByTimeframe,
                                          int minDistinctTimeframes) {
        if (minDistinctTimeframes < 1) {
            throw new IllegalArgumentException("minDistinctTimeframes must be >= 1: " + minDistinctTimeframes);
        }

        List<LiquidityZone> all = new ArrayList<>();
        for (List<LiquidityZone> zones : zonesByTimeframe.values()) {
            all.addAll(zones);
        }
        if (all.isEmpty()) {
            return List.of();
        }
        all.sort(Comparator.comparingDouble(LiquidityZone::midpoint));

        List<ConfluenceZone> result = new ArrayList<>();
        List<LiquidityZone> group = new ArrayList<>();
        for (LiquidityZone zone : all) {
            if (!group.isEmpty() && !joins(group, zone)) {
                addIfQualified(result, group, minDistinctTimeframes);
                group = new ArrayList<>();
            }
            group.add(zone);
        }
        addIfQualified(result, group, minDistinctTimeframes);

        result.sort(Comparator.comparingInt(ConfluenceZone::confluenceWeight)
            .thenComparingInt(ConfluenceZone::distinctTimeframes)
            .reversed());

        log.debug("[CONFLUENCE] {} zone(s) -> {} group(s) with >= {} timeframe(s)",
            all.size(), result.size(), minDistinctTimeframes);
        return result;
    }

    private boolean joins(List<LiquidityZone> group, LiquidityZone zone) {
        LiquidityZone previous = group.get(group.size() - 1);
        Timeframe lead = zone.timeframe();
        for (LiquidityZone member : group) {
            if (weight(member.timeframe()) > weight(lead)) {
                lead = member.timeframe();
            }
        }
        double radius = config(lead).mergeRadiusPct();
        double reference = previous.midpoint();
        if (reference == 0.0) {
            return zone.midpoint() == 0.0;
        }
        return Math.abs(zone.midpoint() - reference) / Math.abs(reference) <= radius;
    }

    private void addIfQualified(List<ConfluenceZone> result, List<LiquidityZone> group, int minDistinct) {
        Set<Timeframe> timeframes = EnumSet.noneOf(Timeframe.class);
        for (LiquidityZone z : group) {
            timeframes.add(z.timeframe());
        }
        if (timeframes.size() < minDistinct) {
            return;
        }

        int weight = 0;
        for (Timeframe tf : timeframes) {
            weight += weight(tf);
        }

        LiquidityZone representative = group.get(0);
        for (LiquidityZone z : group) {
            if (representativeOrder().compare(z, representative) > 0) {
                representative = z;
            }
        }
        result.add(new ConfluenceZone(representative.withConfluenceWeight(weight), weight, timeframes, group));
    }

    private Comparator<LiquidityZone> representativeOrder() {
        return Comparator.<LiquidityZone>comparingInt(z -> weight(z.timeframe()))
            .thenComparingInt(z -> z.strength().rank())
            .thenComparingInt(LiquidityZone::touchCount)
            .thenComparingDouble(LiquidityZone::volume);
    }

    private int weight(Timeframe tf) {
        return config(tf).tfWeight();
    }

    private TimeframeConfig config(Timeframe tf) {
        TimeframeConfig c = configs.get(tf);
        return c != null ? c : TimeframeConfig.defaults(tf);
    }
}

package in.liqmap.service.zone;

import in.liqmap.domain.zone.LiquidityZone;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges candidate zones into an existing zone set.
 *
 * A candidate whose range overlaps a same-side zone within the merge radius merges into it:
 * the zone with higher (strength, touch count) survives and its touch count goes up by one.
 * Otherwise the candidate is added. Merging with no candidates returns the set unchanged.
 */
public final class ZoneMerger {

    /**
     * Outcome of a merge pass.
     *
     * @param zones  resulting zone set
     * @param added  candidates added as new zones
     * @param merged candidates folded into an existing zone
     */
    public record MergeResult(List<LiquidityZone> zones, int added, int merged) {}

    public static MergeResult merge(List<LiquidityZone> existing, List<LiquidityZone> candidates, double radiusPct) {
        List<LiquidityZone> zones = new ArrayList<>(existing);
        int added = 0;
        int merged = 0;

        for (LiquidityZone candidate : candidates) {
            int match = findOverlap(zones, candidate, radiusPct);
            if (match < 0) {
                zones.add(candidate);
                added++;
                continue;
            }
            LiquidityZone current = zones.get(match);
            LiquidityZone keep = dominates(candidate, current) ? candidate : current;
            zones.set(match, keep.withTouchCount(Math.max(keep.touchCount(), current.touchCount()) + 1));
            merged++;
        }
        return new MergeResult(zones, added, merged);
    }

    private static int findOverlap(List<LiquidityZone> zones, LiquidityZone candidate, double radiusPct) {
        for (int i = 0; i < zones.size(); i++) {
            LiquidityZone z = zones.get(i);
            if (z.side() == candidate.side() && z.overlapsWithin(candidate, radiusPct)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * True if a beats b on (strength, touch count); ties keep b.
     */
    private static boolean dominates(LiquidityZone a, LiquidityZone b) {
        if (a.strength().rank() != b.strength().rank()) {
            return a.strength().rank() > b.strength().rank();
        }
        return a.touchCount() > b.touchCount();
    }

    private ZoneMerger() {}
}

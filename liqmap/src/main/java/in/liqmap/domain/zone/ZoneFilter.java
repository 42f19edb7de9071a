package in.liqmap.domain.zone;

import java.util.EnumSet;
import java.util.Set;

/**
 * Query filter for zone lookups. A null field means "any".
 */
public record ZoneFilter(
    Set<ZoneKind> kinds,
    ZoneSide side,
    ZoneStrength minStrength,
    boolean includeMitigated
) {
    public ZoneFilter {
        kinds = kinds == null || kinds.isEmpty() ? null : Set.copyOf(kinds);
    }

    /**
     * Every zone, mitigated ones included.
     */
    public static ZoneFilter all() {
        return new ZoneFilter(null, null, null, true);
    }

    /**
     * Unmitigated zones only.
     */
    public static ZoneFilter active() {
        return new ZoneFilter(null, null, null, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(LiquidityZone zone) {
        if (!includeMitigated && zone.mitigated()) {
            return false;
        }
        if (kinds != null && !kinds.contains(zone.kind())) {
            return false;
        }
        if (side != null && zone.side() != side) {
            return false;
        }
        return minStrength == null || zone.strength().isAtLeast(minStrength);
    }

    public static final class Builder {
        private final Set<ZoneKind> kinds = EnumSet.noneOf(ZoneKind.class);
        private ZoneSide side;
        private ZoneStrength minStrength;
        private boolean includeMitigated = false;

        public Builder kind(ZoneKind kind) {
            this.kinds.add(kind);
            return this;
        }

        public Builder side(ZoneSide side) {
            this.side = side;
            return this;
        }

        public Builder minStrength(ZoneStrength minStrength) {
            this.minStrength = minStrength;
            return this;
        }

        public Builder includeMitigated(boolean includeMitigated) {
            this.includeMitigated = includeMitigated;
            return this;
        }

        public ZoneFilter build() {
            return new ZoneFilter(kinds, side, minStrength, includeMitigated);
        }
    }
}

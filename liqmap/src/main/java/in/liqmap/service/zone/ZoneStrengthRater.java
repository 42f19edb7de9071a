package in.liqmap.service.zone;

import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneStrength;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-rates active zones from how often they were tested and how much volume built them.
 *
 * The high-volume threshold is the 70th percentile of active zone volumes. Strong zones have at
 * least three touches and high volume; moderate zones have two touches or half the threshold.
 * Mitigated zones keep the strength they had when price closed through them.
 */
final class ZoneStrengthRater {

    static final int STRONG_TOUCHES = 3;
    static final int MODERATE_TOUCHES = 2;
    static final double HIGH_VOLUME_PERCENTILE = 0.7;

    static List<LiquidityZone> rate(List<LiquidityZone> zones) {
        double[] volumes = zones.stream()
            .filter(z -> !z.mitigated())
            .mapToDouble(LiquidityZone::volume)
            .sorted()
            .toArray();
        if (volumes.length == 0) {
            return zones;
        }
        double highVolume = volumes[(int) (volumes.length * HIGH_VOLUME_PERCENTILE)];

        List<LiquidityZone> rated = new ArrayList<>(zones.size());
        for (LiquidityZone z : zones) {
            rated.add(z.mitigated() ? z : z.withStrength(strength(z, highVolume)));
        }
        return rated;
    }

    static ZoneStrength strength(LiquidityZone zone, double highVolume) {
        if (zone.touchCount() >= STRONG_TOUCHES && zone.volume() >= highVolume) {
            return ZoneStrength.STRONG;
        }
        if (zone.touchCount() >= MODERATE_TOUCHES || zone.volume() >= highVolume * 0.5) {
            return ZoneStrength.MODERATE;
        }
        return ZoneStrength.WEAK;
    }

    private ZoneStrengthRater() {}
}

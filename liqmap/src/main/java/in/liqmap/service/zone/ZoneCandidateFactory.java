package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneSide;
import in.liqmap.domain.zone.ZoneStrength;
import in.liqmap.service.indicator.PivotDetector;
import in.liqmap.service.indicator.PivotDetector.Pivot;
import in.liqmap.service.indicator.VolumeClusterDetector;
import in.liqmap.service.indicator.VolumeClusterDetector.VolumeCluster;

import java.util.ArrayList;
import java.util.List;

/**
 * Support/resistance candidates from swing pivots confirmed by the volume profile.
 *
 * A swing high (low) becomes a resistance (support) candidate only if some high-volume price
 * level lies within {@value #VOLUME_PROXIMITY} of the pivot price. The zone spans the pivot
 * price plus/minus the configured buffer; strength scales with the nearby volume relative to
 * the heaviest cluster.
 */
public final class ZoneCandidateFactory {

    static final double VOLUME_PROXIMITY = 0.005;

    public static List<LiquidityZone> supportResistance(String symbol, Timeframe timeframe,
                                                        List<Candle> candles, TimeframeConfig config) {
        List<VolumeCluster> clusters = VolumeClusterDetector.findHighVolumeLevels(
            candles, config.minVolumePercentile(), VolumeClusterDetector.DEFAULT_BINS);
        if (clusters.isEmpty()) {
            return List.of();
        }
        double maxClusterVolume = 0.0;
        for (VolumeCluster c : clusters) {
            maxClusterVolume = Math.max(maxClusterVolume, c.volume());
        }

        List<LiquidityZone> zones = new ArrayList<>();
        for (Pivot p : PivotDetector.findSwingHighs(candles, config.pivotLeft(), config.pivotRight())) {
            addIfBacked(zones, symbol, timeframe, p, ZoneSide.RESISTANCE, clusters, maxClusterVolume, config);
        }
        for (Pivot p : PivotDetector.findSwingLows(candles, config.pivotLeft(), config.pivotRight())) {
            addIfBacked(zones, symbol, timeframe, p, ZoneSide.SUPPORT, clusters, maxClusterVolume, config);
        }
        return zones;
    }

    private static void addIfBacked(List<LiquidityZone> zones, String symbol, Timeframe timeframe, Pivot pivot,
                                    ZoneSide side, List<VolumeCluster> clusters, double maxClusterVolume,
                                    TimeframeConfig config) {
        double nearbyVolume = 0.0;
        for (VolumeCluster c : clusters) {
            if (Math.abs(c.price() - pivot.price()) <= pivot.price() * VOLUME_PROXIMITY) {
                nearbyVolume += c.volume();
            }
        }
        if (nearbyVolume <= 0.0) {
            return;
        }

        double pad = pivot.price() * config.zoneBufferPct();
        ZoneKind kind = side == ZoneSide.RESISTANCE ? ZoneKind.RESISTANCE : ZoneKind.SUPPORT;
        String id = symbol + "_" + timeframe.getLabel() + "_" + (side == ZoneSide.RESISTANCE ? "R_" : "S_") + pivot.openTs();
        ZoneStrength strength = ZoneStrength.fromScore(Math.min(1.0, nearbyVolume / maxClusterVolume));
        zones.add(LiquidityZone.of(id, timeframe, kind, side, pivot.price() - pad, pivot.price() + pad,
            pivot.openTs(), strength, nearbyVolume));
    }

    private ZoneCandidateFactory() {}
}

package in.liqmap.service.zone;

import in.liqmap.domain.data.Timeframe;
import in.liqmap.service.indicator.Volatility;

/**
 * Outcome of one timeframe refresh.
 *
 * @param skipReason  why detection did not run, or null when it ran
 * @param volatility  ATR classification, or null when the refresh was rejected before it
 * @param candidates  candidates detected this refresh (before filters)
 * @param created     zones added
 * @param merged      candidates merged into existing zones
 * @param aged        zones removed by age
 * @param activeZones zone-set size after the refresh
 */
public record RefreshResult(
    Timeframe timeframe,
    String skipReason,
    Volatility volatility,
    int candidates,
    int created,
    int merged,
    int aged,
    int activeZones
) {
    public static RefreshResult rejected(Timeframe timeframe, String reason, int activeZones) {
        return new RefreshResult(timeframe, reason, null, 0, 0, 0, 0, activeZones);
    }

    public boolean detectionRan() {
        return skipReason == null;
    }
}

package in.liqmap.domain.sync;

import in.liqmap.domain.data.Candle;

/**
 * Result of CandleSync.onClosedCandle.
 *
 * Sequencing problems are reported here rather than thrown.
 */
public record SyncResult(
    SyncStatus status,
    Candle candle,
    GapRange gap,          // only for GAP_DETECTED
    boolean bootstrap,     // true when this candle initialized an unseeded sync
    String reason
) {
    public static SyncResult bootstrap(Candle candle) {
        return new SyncResult(SyncStatus.ACCEPTED, candle, null, true, "accepted, no gap check performed");
    }

    public static SyncResult inSequence(Candle candle) {
        return new SyncResult(SyncStatus.ACCEPTED, candle, null, false, "accepted, in sequence");
    }

    public static SyncResult duplicate(Candle candle) {
        return new SyncResult(SyncStatus.DUPLICATE_UPDATE, candle, null, false, "duplicate-update");
    }

    public static SyncResult gap(Candle candle, GapRange gap) {
        return new SyncResult(SyncStatus.GAP_DETECTED, candle, gap, false,
            "gap of " + gap.missingCount() + " candle(s)");
    }

    public static SyncResult stale(Candle candle, long lastOpenTs) {
        return new SyncResult(SyncStatus.REJECTED_STALE, candle, null, false,
            "openTs " + candle.openTs() + " is before last accepted " + lastOpenTs);
    }

    public static SyncResult invalid(Candle candle, String reason) {
        return new SyncResult(SyncStatus.REJECTED_INVALID, candle, null, false, reason);
    }

    public boolean isAccepted() {
        return status.isAccepted();
    }

    public boolean hasGap() {
        return status == SyncStatus.GAP_DETECTED;
    }
}

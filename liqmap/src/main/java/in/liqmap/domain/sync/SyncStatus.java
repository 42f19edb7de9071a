package in.liqmap.domain.sync;

/**
 * Outcome of offering a closed candle to a candle sync.
 */
public enum SyncStatus {
    /** Accepted; either the bootstrap candle or the next expected one. */
    ACCEPTED,

    /** Same open timestamp as the last accepted candle; accepted as a replacement. */
    DUPLICATE_UPDATE,

    /** Accepted after one or more missing intervals; a backfill was requested. */
    GAP_DETECTED,

    /** Older than the last accepted candle; dropped without state change. */
    REJECTED_STALE,

    /** Wrong symbol/timeframe or off-grid timestamp; dropped without state change. */
    REJECTED_INVALID;

    /**
     * Whether the candle became part of the series.
     */
    public boolean isAccepted() {
        return this == ACCEPTED || this == DUPLICATE_UPDATE || this == GAP_DETECTED;
    }
}

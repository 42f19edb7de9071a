package in.liqmap.domain.sync;

/**
 * Inclusive range of missing candle open timestamps.
 *
 * @param startTs         first missing open timestamp (epoch seconds)
 * @param endTs           last missing open timestamp (epoch seconds)
 * @param intervalSeconds timeframe interval
 */
public record GapRange(long startTs, long endTs, long intervalSeconds) {
    public GapRange {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive: " + intervalSeconds);
        }
        if (startTs > endTs) {
            throw new IllegalArgumentException("Gap start " + startTs + " is after end " + endTs);
        }
    }

    /**
     * Number of candles missing in this range.
     */
    public long missingCount() {
        return (endTs - startTs) / intervalSeconds + 1;
    }

    public boolean contains(long openTs) {
        return openTs >= startTs && openTs <= endTs;
    }
}

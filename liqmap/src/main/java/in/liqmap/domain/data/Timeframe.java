package in.liqmap.domain.data;

import java.util.Arrays;
import java.util.Optional;

/**
 * Timeframes tracked by the liquidity map.
 *
 * Declared from the highest timeframe to the lowest; that order is also the
 * processing priority when several timeframes close on the same tick.
 */
public enum Timeframe {
    /**
     * 1-hour candles.
     */
    H1("1h", 3600),

    /**
     * 15-minute candles.
     */
    M15("15m", 900),

    /**
     * 5-minute candles.
     */
    M5("5m", 300),

    /**
     * 1-minute candles.
     */
    M1("1m", 60);

    private final String label;
    private final long intervalSeconds;

    Timeframe(String label, long intervalSeconds) {
        this.label = label;
        this.intervalSeconds = intervalSeconds;
    }

    public String getLabel() {
        return label;
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    /**
     * Look up a timeframe by its exchange label ("1m", "5m", "15m", "1h").
     */
    public static Optional<Timeframe> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(tf -> tf.label.equalsIgnoreCase(label.trim()))
            .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}

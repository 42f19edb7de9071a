package in.liqmap.domain.data;

/**
 * OHLCV candle for one interval of a symbol/timeframe.
 *
 * openTs and closeTs are epoch seconds; consecutive candles are one interval apart.
 */
public record Candle(
    String symbol,
    Timeframe timeframe,
    long openTs,
    long closeTs,
    double open,
    double high,
    double low,
    double close,
    double volume,
    boolean closed
) {
    /**
     * Check if candle is bullish (close > open).
     */
    public boolean isBullish() {
        return close > open;
    }

    /**
     * Check if candle is bearish (close < open).
     */
    public boolean isBearish() {
        return close < open;
    }

    /**
     * Get body size (absolute difference between open and close).
     */
    public double bodySize() {
        return Math.abs(close - open);
    }

    /**
     * Full high-low range.
     */
    public double range() {
        return high - low;
    }

    /**
     * Typical price (high + low + close) / 3, used as the candle's volume-weighted price proxy.
     */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }

    /**
     * Create a closed candle from raw values. closeTs is derived from the timeframe interval.
     */
    public static Candle of(String symbol, Timeframe tf, long openTs,
                            double o, double h, double l, double c, double v) {
        return new Candle(symbol, tf, openTs, openTs + tf.getIntervalSeconds() - 1,
            o, h, l, c, v, true);
    }
}

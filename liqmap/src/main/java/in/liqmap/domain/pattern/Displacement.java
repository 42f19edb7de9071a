package in.liqmap.domain.pattern;

import in.liqmap.domain.data.Timeframe;

/**
 * Run of consecutive large-bodied, high-volume candles in one direction.
 *
 * @param startPrice       open of the first candle
 * @param endPrice         close of the last candle
 * @param volumeSurgeRatio average volume of the run over the baseline volume
 * @param detectedTs       openTs of the newest candle in the window the run was found in
 */
public record Displacement(
    String symbol,
    Timeframe timeframe,
    PatternDirection direction,
    double startPrice,
    double endPrice,
    long startTs,
    long endTs,
    int candleCount,
    double totalMove,
    double movePct,
    double avgVolume,
    double volumeSurgeRatio,
    long detectedTs
) {
    public static final int STRONG_MIN_CANDLES = 5;
    public static final double STRONG_MIN_VOLUME_RATIO = 2.0;

    public double midpoint() {
        return (startPrice + endPrice) / 2.0;
    }

    public long durationSeconds() {
        return endTs - startTs;
    }

    public boolean contains(double price) {
        return price >= Math.min(startPrice, endPrice) && price <= Math.max(startPrice, endPrice);
    }

    public boolean isStrong() {
        return isStrong(STRONG_MIN_CANDLES, STRONG_MIN_VOLUME_RATIO);
    }

    public boolean isStrong(int minCandles, double minVolumeRatio) {
        return candleCount >= minCandles && volumeSurgeRatio >= minVolumeRatio;
    }
}

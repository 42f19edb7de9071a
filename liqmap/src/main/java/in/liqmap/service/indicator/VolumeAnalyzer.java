package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;

import java.util.List;

/**
 * Trailing-volume statistics.
 */
public final class VolumeAnalyzer {

    /** Trailing window used for the spike ratio. */
    public static final int DEFAULT_WINDOW = 20;

    /**
     * Mean volume over candles[from, to).
     *
     * @return average, or null for an empty range
     */
    public static Double average(List<Candle> candles, int from, int to) {
        if (candles == null || from < 0 || to > candles.size() || from >= to) {
            return null;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += candles.get(i).volume();
        }
        return sum / (to - from);
    }

    /**
     * Ratio of candles[index].volume to the mean volume of the up to {@code window} candles
     * before it.
     *
     * @return ratio, or null when there is no trailing data or the trailing average is zero
     */
    public static Double spikeRatio(List<Candle> candles, int index, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Volume window must be positive: " + window);
        }
        if (candles == null || index <= 0 || index >= candles.size()) {
            return null;
        }
        Double avg = average(candles, Math.max(0, index - window), index);
        if (avg == null || avg == 0.0) {
            return null;
        }
        return candles.get(index).volume() / avg;
    }

    private VolumeAnalyzer() {}
}

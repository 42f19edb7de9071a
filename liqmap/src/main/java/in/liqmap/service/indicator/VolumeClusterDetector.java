package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Volume-at-price clustering.
 *
 * Bins each candle's typical price over the window's price range and keeps the bins whose
 * volume is at or above a percentile of all bin volumes.
 */
public final class VolumeClusterDetector {

    public static final int DEFAULT_BINS = 50;

    /**
     * High-volume price level.
     *
     * @param price  bin centre
     * @param volume volume traded in the bin
     */
    public record VolumeCluster(double price, double volume) {}

    /**
     * @param percentile volume percentile threshold, 0..100
     * @param bins       number of bin edges across the price range (bins - 1 buckets)
     */
    public static List<VolumeCluster> findHighVolumeLevels(List<Candle> candles, double percentile, int bins) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be within [0, 100]: " + percentile);
        }
        if (bins < 2) {
            throw new IllegalArgumentException("bins must be >= 2: " + bins);
        }
        List<VolumeCluster> clusters = new ArrayList<>();
        if (candles == null || candles.isEmpty()) {
            return clusters;
        }

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Candle c : candles) {
            double p = c.typicalPrice();
            min = Math.min(min, p);
            max = Math.max(max, p);
        }

        if (max == min) {
            double total = candles.stream().mapToDouble(Candle::volume).sum();
            clusters.add(new VolumeCluster(min, total));
            return clusters;
        }

        int buckets = bins - 1;
        double width = (max - min) / buckets;
        double[] volumeByBucket = new double[buckets];
        for (Candle c : candles) {
            int idx = (int) ((c.typicalPrice() - min) / width);
            volumeByBucket[Math.min(idx, buckets - 1)] += c.volume();
        }

        double threshold = percentile(volumeByBucket, percentile);
        for (int i = 0; i < buckets; i++) {
            if (volumeByBucket[i] > 0 && volumeByBucket[i] >= threshold) {
                clusters.add(new VolumeCluster(min + width * (i + 0.5), volumeByBucket[i]));
            }
        }
        return clusters;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentile(double[] values, double pct) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    private VolumeClusterDetector() {}
}

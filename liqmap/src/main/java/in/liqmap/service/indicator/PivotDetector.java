package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Swing pivot detection.
 *
 * Candle i is a swing high when its high is strictly greater than every high in
 * [i-left, i-1] and [i+1, i+right]; swing lows mirror this on lows. Only confirmed pivots
 * (with {@code right} candles after them) are returned.
 */
public final class PivotDetector {

    public enum PivotType {
        HIGH,
        LOW
    }

    /**
     * Confirmed swing point.
     *
     * @param index  position in the analysed candle list
     * @param price  the pivot high or low
     * @param openTs open timestamp of the pivot candle
     */
    public record Pivot(PivotType type, int index, double price, long openTs) {}

    public static List<Pivot> findSwingHighs(List<Candle> candles, int left, int right) {
        return find(candles, left, right, PivotType.HIGH);
    }

    public static List<Pivot> findSwingLows(List<Candle> candles, int left, int right) {
        return find(candles, left, right, PivotType.LOW);
    }

    private static List<Pivot> find(List<Candle> candles, int left, int right, PivotType type) {
        if (left < 1 || right < 1) {
            throw new IllegalArgumentException("Pivot windows must be >= 1: left=" + left + ", right=" + right);
        }
        List<Pivot> pivots = new ArrayList<>();
        if (candles == null || candles.size() < left + right + 1) {
            return pivots;
        }

        for (int i = left; i < candles.size() - right; i++) {
            double price = type == PivotType.HIGH ? candles.get(i).high() : candles.get(i).low();
            if (isPivot(candles, i, left, right, price, type)) {
                pivots.add(new Pivot(type, i, price, candles.get(i).openTs()));
            }
        }
        return pivots;
    }

    private static boolean isPivot(List<Candle> candles, int i, int left, int right, double price, PivotType type) {
        for (int j = i - left; j <= i + right; j++) {
            if (j == i) {
                continue;
            }
            Candle other = candles.get(j);
            if (type == PivotType.HIGH ? other.high() >= price : other.low() <= price) {
                return false;
            }
        }
        return true;
    }

    private PivotDetector() {}
}

package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;

import java.util.List;

/**
 * ATR Calculator - Average True Range over closed candles.
 *
 * Calculation Method:
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 * - ATR: simple mean of the last {@code period} true ranges
 * - Baseline: ATR of the window with its last {@code period} candles removed
 */
public final class ATRCalculator {

    /** Standard ATR period. */
    public static final int DEFAULT_PERIOD = 14;

    /**
     * Calculate ATR as the mean of the last period true ranges.
     *
     * @param candles Candles in chronological order (oldest first)
     * @param period  ATR period (typically 14)
     * @return ATR value, or null if fewer than period + 1 candles
     */
    public static Double calculate(List<Candle> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (candles == null || candles.size() < period + 1) {
            return null;
        }

        double sum = 0.0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sum += trueRange(candles.get(i), candles.get(i - 1));
        }
        return sum / period;
    }

    /**
     * Calculate True Range for a candle.
     *
     * @param current  Current candle
     * @param previous Previous candle
     * @return True Range value
     */
    public static double trueRange(Candle current, Candle previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Candles cannot be null");
        }
        double highLow = current.high() - current.low();
        double highPrevClose = Math.abs(current.high() - previous.close());
        double lowPrevClose = Math.abs(current.low() - previous.close());
        return Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
    }

    /**
     * Historical ATR baseline: ATR of the window excluding its most recent period candles.
     *
     * @return baseline, or null unless more than 2 x period candles are available
     */
    public static Double baseline(List<Candle> candles, int period) {
        if (candles == null || candles.size() <= period * 2) {
            return null;
        }
        return calculate(candles.subList(0, candles.size() - period), period);
    }

    /**
     * Classify the current ATR against the baseline.
     *
     * LOW when current is below minMultiplier x baseline, HIGH when above
     * maxMultiplier x baseline, otherwise NORMAL. Missing data is NORMAL.
     */
    public static Volatility classify(Double current, Double baseline, double minMultiplier, double maxMultiplier) {
        if (current == null || baseline == null || baseline <= 0.0) {
            return Volatility.NORMAL;
        }
        if (current < minMultiplier * baseline) {
            return Volatility.LOW;
        }
        if (current > maxMultiplier * baseline) {
            return Volatility.HIGH;
        }
        return Volatility.NORMAL;
    }

    /**
     * Current ATR, baseline and regime in one pass.
     */
    public static ATRResult assess(List<Candle> candles, int period, double minMultiplier, double maxMultiplier) {
        Double atr = calculate(candles, period);
        Double base = baseline(candles, period);
        return new ATRResult(atr, base, classify(atr, base, minMultiplier, maxMultiplier));
    }

    /**
     * Result of a volatility assessment.
     */
    public record ATRResult(
        Double atr,         // current ATR, null if insufficient data
        Double baseline,    // historical ATR, null if insufficient data
        Volatility volatility
    ) {
        public boolean isExtreme() {
            return volatility != Volatility.NORMAL;
        }

        public String getSummary() {
            return String.format("ATR=%s baseline=%s regime=%s",
                atr == null ? "n/a" : String.format("%.6f", atr),
                baseline == null ? "n/a" : String.format("%.6f", baseline),
                volatility);
        }
    }

    private ATRCalculator() {}
}

package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.pattern.Displacement;
import in.liqmap.domain.pattern.PatternDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds displacement runs: at least {@code minCandles} consecutive candles of one colour, each
 * with volume at least {@code minVolumeRatio} x baseline and a body covering at least
 * {@code minBodyPct} of its range.
 *
 * The baseline is the mean volume of the last {@code volumeLookback} candles of the window.
 * Scanning starts after the lookback and resumes past each run found, so runs never overlap.
 */
public final class DisplacementDetector {

    public static final int DEFAULT_MIN_CANDLES = 3;
    public static final double DEFAULT_MIN_VOLUME_RATIO = 1.5;
    public static final double DEFAULT_MIN_BODY_PCT = 0.6;
    public static final int DEFAULT_VOLUME_LOOKBACK = 20;

    private final int minCandles;
    private final double minVolumeRatio;
    private final double minBodyPct;
    private final int volumeLookback;

    public DisplacementDetector() {
        this(DEFAULT_MIN_CANDLES, DEFAULT_MIN_VOLUME_RATIO, DEFAULT_MIN_BODY_PCT, DEFAULT_VOLUME_LOOKBACK);
    }

    public DisplacementDetector(int minCandles, double minVolumeRatio, double minBodyPct, int volumeLookback) {
        if (minCandles < 1 || volumeLookback < 1) {
            throw new IllegalArgumentException(
                "minCandles and volumeLookback must be positive: " + minCandles + ", " + volumeLookback);
        }
        this.minCandles = minCandles;
        this.minVolumeRatio = minVolumeRatio;
        this.minBodyPct = minBodyPct;
        this.volumeLookback = volumeLookback;
    }

    public List<Displacement> detect(List<Candle> candles) {
        if (candles == null || candles.size() < minCandles + volumeLookback) {
            return List.of();
        }
        Double baseline = VolumeAnalyzer.average(candles, candles.size() - volumeLookback, candles.size());
        long detectedTs = candles.get(candles.size() - 1).openTs();

        List<Displacement> result = new ArrayList<>();
        int i = volumeLookback;
        while (i < candles.size()) {
            Displacement d = runAt(candles, i, baseline, detectedTs);
            if (d != null) {
                result.add(d);
                i += d.candleCount();
            } else {
                i++;
            }
        }
        return result;
    }

    private Displacement runAt(List<Candle> candles, int start, double baseline, long detectedTs) {
        Candle first = candles.get(start);
        if (!qualifies(first, baseline)) {
            return null;
        }
        boolean bullish = first.isBullish();
        int end = start;
        double totalVolume = first.volume();
        for (int j = start + 1; j < candles.size(); j++) {
            Candle c = candles.get(j);
            if (c.isBullish() != bullish || !qualifies(c, baseline)) {
                break;
            }
            end = j;
            totalVolume += c.volume();
        }
        int count = end - start + 1;
        if (count < minCandles) {
            return null;
        }

        Candle last = candles.get(end);
        double totalMove = Math.abs(last.close() - first.open());
        double avgVolume = totalVolume / count;
        return new Displacement(first.symbol(), first.timeframe(),
            bullish ? PatternDirection.BULLISH : PatternDirection.BEARISH,
            first.open(), last.close(), first.openTs(), last.openTs(), count,
            totalMove, totalMove / first.open() * 100.0,
            avgVolume, baseline > 0.0 ? avgVolume / baseline : 1.0, detectedTs);
    }

    private boolean qualifies(Candle c, double baseline) {
        if (c.volume() < baseline * minVolumeRatio) {
            return false;
        }
        double range = c.range();
        return range != 0.0 && c.bodySize() / range >= minBodyPct;
    }
}

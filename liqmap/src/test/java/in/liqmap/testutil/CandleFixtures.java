package in.liqmap.testutil;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Candle builders for tests.
 */
public final class CandleFixtures {

    public static final String SYMBOL = "BTCUSDT";

    public static Candle candle(Timeframe tf, long openTs, double open, double high, double low, double close,
                                double volume) {
        return Candle.of(SYMBOL, tf, openTs, open, high, low, close, volume);
    }

    /**
     * Candle with open == close at price and the given high/low.
     */
    public static Candle doji(Timeframe tf, long openTs, double price, double high, double low, double volume) {
        return candle(tf, openTs, price, high, low, price, volume);
    }

    /**
     * Flat series: every candle opens and closes at price with a fixed +/- halfRange wick.
     */
    public static List<Candle> flat(Timeframe tf, long startTs, int count, double price, double halfRange,
                                    double volume) {
        List<Candle> candles = new ArrayList<>(count);
        long interval = tf.getIntervalSeconds();
        for (int i = 0; i < count; i++) {
            candles.add(doji(tf, startTs + i * interval, price, price + halfRange, price - halfRange, volume));
        }
        return candles;
    }

    /**
     * Series through the given closes; each candle opens at the previous close and has a wick
     * of halfRange beyond its body.
     */
    public static List<Candle> fromCloses(Timeframe tf, long startTs, double[] closes, double halfRange,
                                          double volume) {
        List<Candle> candles = new ArrayList<>(closes.length);
        long interval = tf.getIntervalSeconds();
        double open = closes[0];
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            double high = Math.max(open, close) + halfRange;
            double low = Math.min(open, close) - halfRange;
            candles.add(candle(tf, startTs + i * interval, open, high, low, close, volume));
            open = close;
        }
        return candles;
    }

    private CandleFixtures() {}
}

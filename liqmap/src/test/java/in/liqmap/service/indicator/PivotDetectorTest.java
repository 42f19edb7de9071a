package in.liqmap.service.indicator;

import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.service.indicator.PivotDetector.Pivot;
import in.liqmap.service.indicator.PivotDetector.PivotType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static in.liqmap.testutil.CandleFixtures.doji;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PivotDetectorTest {

    private static List<Candle> fromHighsAndLows(double[] highs, double[] lows) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < highs.length; i++) {
            double mid = (highs[i] + lows[i]) / 2;
            candles.add(doji(Timeframe.M5, i * 300L, mid, highs[i], lows[i], 1));
        }
        return candles;
    }

    @Test
    void testFindsConfirmedSwingHighAndLow() {
        double[] highs = {10, 11, 12, 15, 12, 11, 10, 11, 12};
        double[] lows  = {8, 7, 7, 9, 8, 5, 8, 9, 9};
        List<Candle> candles = fromHighsAndLows(highs, lows);

        List<Pivot> swingHighs = PivotDetector.findSwingHighs(candles, 2, 2);
        List<Pivot> swingLows = PivotDetector.findSwingLows(candles, 2, 2);

        assertEquals(List.of(new Pivot(PivotType.HIGH, 3, 15, 900)), swingHighs);
        assertEquals(List.of(new Pivot(PivotType.LOW, 5, 5, 1500)), swingLows);
    }

    @Test
    void testEqualNeighbourIsNotAPivot() {
        double[] highs = {10, 12, 15, 15, 12, 10};
        double[] lows  = {9, 9, 9, 9, 9, 9};

        assertTrue(PivotDetector.findSwingHighs(fromHighsAndLows(highs, lows), 2, 2).isEmpty(),
            "pivot requires strictly higher high than every neighbour");
    }

    @Test
    void testUnconfirmedPivotAtEdgeIsIgnored() {
        double[] highs = {10, 11, 12, 13, 20};
        double[] lows  = {9, 9, 9, 9, 9};

        assertTrue(PivotDetector.findSwingHighs(fromHighsAndLows(highs, lows), 2, 2).isEmpty());
    }

    @Test
    void testInvalidWindowThrows() {
        assertThrows(IllegalArgumentException.class, () -> PivotDetector.findSwingHighs(List.of(), 0, 2));
    }
}

package in.liqmap.service.plugin;

import in.liqmap.config.TimeframeConfig;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.pattern.FairValueGap;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneSide;
import in.liqmap.domain.zone.ZoneStrength;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static in.liqmap.testutil.CandleFixtures.SYMBOL;
import static in.liqmap.testutil.CandleFixtures.candle;
import static in.liqmap.testutil.CandleFixtures.doji;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FairValueGapPluginTest {

    private static final Timeframe TF = Timeframe.M5;
    private static final long START = 1_700_000_100L;
    private static final TimeframeConfig CONFIG = TimeframeConfig.defaults(TF);

    private final FairValueGapPlugin plugin = new FairValueGapPlugin(SYMBOL, TF);

    private static long ts(int i) {
        return START + i * TF.getIntervalSeconds();
    }

    /**
     * Drop from 100 to 94 leaving a gap between 96 (third candle high) and 99 (first candle low).
     */
    private static List<Candle> dropSeries() {
        List<Candle> candles = new ArrayList<>();
        candles.add(doji(TF, ts(0), 100.0, 101.0, 99.0, 25));
        candles.add(candle(TF, ts(1), 99.0, 99.0, 95.0, 95.0, 80));
        candles.add(doji(TF, ts(2), 94.0, 96.0, 93.0, 30));
        candles.add(doji(TF, ts(3), 94.5, 95.5, 93.5, 20));
        return candles;
    }

    private static List<Candle> append(List<Candle> candles, Candle next) {
        List<Candle> result = new ArrayList<>(candles);
        result.add(next);
        return result;
    }

    @Test
    void detect_gapBetweenOuterWicks() {
        // Act
        List<FairValueGap> found = plugin.detect(dropSeries(), CONFIG);

        // Assert
        assertEquals(1, found.size());
        FairValueGap gap = found.get(0);
        assertEquals(SYMBOL + "_5m_fvg_bull_" + ts(1), gap.id());
        assertEquals(PatternDirection.BULLISH, gap.direction());
        assertEquals(99.0, gap.gapHigh(), 1e-12);
        assertEquals(96.0, gap.gapLow(), 1e-12);
        assertEquals(ts(1), gap.createdTs());
        assertEquals(25, gap.volumeBefore(), 1e-12);

        LiquidityZone zone = plugin.toZone(gap, CONFIG).orElseThrow();
        assertEquals(ZoneKind.FAIR_VALUE_GAP, zone.kind());
        assertEquals(ZoneSide.SUPPORT, zone.side());
        assertEquals(ZoneStrength.MODERATE, zone.strength());
    }

    @Test
    void detect_bearishGap() {
        List<Candle> candles = List.of(
            doji(TF, ts(0), 100.0, 101.0, 99.0, 10),
            candle(TF, ts(1), 101.0, 105.0, 101.0, 105.0, 60),
            doji(TF, ts(2), 103.0, 104.0, 102.0, 10));

        List<FairValueGap> found = plugin.detect(candles, CONFIG);

        assertEquals(1, found.size());
        assertEquals(102.0, found.get(0).gapHigh(), 1e-12);
        assertEquals(101.0, found.get(0).gapLow(), 1e-12);
        assertEquals(1, plugin.getUnfilled(PatternDirection.BEARISH).size());
        assertTrue(plugin.getUnfilled(PatternDirection.BULLISH).isEmpty());
    }

    @Test
    void update_partialTouchThenFill() {
        // Arrange
        List<Candle> candles = dropSeries();
        plugin.detect(candles, CONFIG);
        plugin.update(candles, 94.5, CONFIG);
        assertEquals(0, plugin.getAll().get(0).touchCount(), "pattern candles never touch their own gap");

        // Act
        candles = append(candles, doji(TF, ts(4), 99.5, 100.0, 98.5, 10));
        plugin.update(candles, 99.5, CONFIG);
        FairValueGap partial = plugin.getAll().get(0);

        candles = append(candles, doji(TF, ts(5), 97.0, 97.5, 96.5, 10));
        plugin.update(candles, 97.0, CONFIG);

        // Assert
        assertEquals(1, partial.touchCount());
        assertEquals(100.0 / 6.0, partial.fillPercentage(), 1e-9, "0.5 of a 3.0 gap");
        assertFalse(partial.filled());

        FairValueGap filled = plugin.getAll().get(0);
        assertEquals(2, filled.touchCount());
        assertTrue(filled.filled());
        assertTrue(plugin.getUnfilled(null).isEmpty());
        assertTrue(plugin.getNearest(97.0, SearchDirection.BOTH).isEmpty());
    }

    @Test
    void getNearest_respectsDirection() {
        plugin.detect(dropSeries(), CONFIG);

        assertTrue(plugin.getNearest(100.0, SearchDirection.BELOW).isPresent());
        assertTrue(plugin.getNearest(100.0, SearchDirection.ABOVE).isEmpty());
        assertTrue(plugin.getNearest(90.0, SearchDirection.ABOVE).isPresent());
    }
}

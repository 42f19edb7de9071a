package in.liqmap.service.zone;

import in.liqmap.config.TimeframeConfigService;
import in.liqmap.domain.data.Candle;
import in.liqmap.domain.data.Timeframe;
import in.liqmap.domain.data.TrendDirection;
import in.liqmap.domain.pattern.Displacement;
import in.liqmap.domain.pattern.LiquiditySweep;
import in.liqmap.domain.pattern.LiquiditySweep.SweepType;
import in.liqmap.domain.pattern.PatternDirection;
import in.liqmap.domain.zone.ConfluenceZone;
import in.liqmap.domain.zone.FilterStage;
import in.liqmap.domain.zone.LiquidityZone;
import in.liqmap.domain.zone.PdPosition;
import in.liqmap.domain.zone.PremiumDiscount;
import in.liqmap.domain.zone.ZoneFilter;
import in.liqmap.domain.zone.ZoneKind;
import in.liqmap.domain.zone.ZoneSide;
import in.liqmap.domain.zone.ZoneStrength;
import in.liqmap.infrastructure.metrics.ZoneMetrics;
import in.liqmap.service.indicator.Volatility;
import in.liqmap.service.plugin.BreakerBlockPlugin;
import in.liqmap.service.plugin.FairValueGapPlugin;
import in.liqmap.service.plugin.LiquidityLevelPlugin;
import in.liqmap.service.plugin.LiquiditySweepPlugin;
import in.liqmap.service.plugin.OrderBlockPlugin;
import in.liqmap.service.plugin.PluginStatus;
import in.liqmap.service.plugin.StructureBreakPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static in.liqmap.testutil.CandleFixtures.SYMBOL;
import static in.liqmap.testutil.CandleFixtures.candle;
import static in.liqmap.testutil.CandleFixtures.doji;
import static in.liqmap.testutil.CandleFixtures.flat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LiquidityMapTest {

    private static final long START = 1_700_000_100L;
    private static final String[] PLUGINS = {
        OrderBlockPlugin.NAME, FairValueGapPlugin.NAME, LiquidityLevelPlugin.NAME,
        StructureBreakPlugin.NAME, BreakerBlockPlugin.NAME, LiquiditySweepPlugin.NAME
    };

    @Mock
    private ZoneMetrics metrics;

    private LiquidityMap map;

    @BeforeEach
    void setUp() {
        map = new LiquidityMap(SYMBOL, TimeframeConfigService.withDefaults(),
            EnumSet.of(Timeframe.M15, Timeframe.M5), metrics);
    }

    /**
     * Support/resistance only, so zone counts are not mixed with pattern zones.
     */
    private void disablePlugins() {
        for (String name : PLUGINS) {
            map.disablePlugin(name);
        }
    }

    private static long ts(Timeframe tf, int i) {
        return START + i * tf.getIntervalSeconds();
    }

    /**
     * Eleven candles ranging 99..101 around 100 with a swing low at 98 on index 5.
     */
    private static List<Candle> swingLowSeries(Timeframe tf, double pivotVolume) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            if (i == 5) {
                candles.add(doji(tf, ts(tf, i), 98.2, 98.5, 98.0, pivotVolume));
            } else {
                candles.add(doji(tf, ts(tf, i), 100.0, 101.0, 99.0, 10));
            }
        }
        return candles;
    }

    /**
     * 20 quiet candles, a three-candle bullish run on 4x volume, two quiet candles, then a
     * three-candle bearish run back to 100.
     */
    private static List<Candle> twoDisplacements(Timeframe tf) {
        List<Candle> candles = new ArrayList<>(flat(tf, START, 20, 100.0, 0.5, 10));
        for (int k = 0; k < 3; k++) {
            double open = 100.0 + k;
            candles.add(candle(tf, ts(tf, 20 + k), open, open + 1.1, open - 0.05, open + 1.0, 40));
        }
        candles.addAll(flat(tf, ts(tf, 23), 2, 103.0, 0.5, 10));
        for (int k = 0; k < 3; k++) {
            double open = 103.0 - k;
            candles.add(candle(tf, ts(tf, 25 + k), open, open + 0.05, open - 1.1, open - 1.0, 40));
        }
        return candles;
    }

    private static Candle bar(Timeframe tf, int i, double high, double low) {
        double mid = (high + low) / 2.0;
        return candle(tf, ts(tf, i), mid, high, low, mid, 10);
    }

    private static List<Candle> append(List<Candle> candles, Candle next) {
        List<Candle> result = new ArrayList<>(candles);
        result.add(next);
        return result;
    }

    @Test
    void onCandleClose_createsVolumeBackedSupport() {
        // Arrange
        disablePlugins();

        // Act
        RefreshResult result = map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);

        // Assert
        assertTrue(result.detectionRan());
        assertEquals(Volatility.NORMAL, result.volatility(), "short window has no ATR baseline");
        assertEquals(1, result.candidates());
        assertEquals(1, result.created());
        assertEquals(1, result.activeZones());

        List<LiquidityZone> zones = map.getZones(Timeframe.M5, ZoneFilter.active());
        assertEquals(1, zones.size());
        LiquidityZone support = zones.get(0);
        assertEquals(ZoneKind.SUPPORT, support.kind());
        assertEquals(ts(Timeframe.M5, 5), support.createdTs());
        assertEquals(98.0 - 98.0 * 0.001, support.priceLow(), 1e-9);
        assertEquals(ZoneStrength.MODERATE, support.strength(), "untouched zone holding the top volume");

        assertEquals(support, map.getNearestSupport(Timeframe.M5, 100.0).orElseThrow());
        assertTrue(map.getNearestResistance(Timeframe.M5, 100.0).isEmpty());
        assertTrue(map.getZones(Timeframe.M15, ZoneFilter.all()).isEmpty());
        assertEquals(1, map.getStatistics().totalZonesCreated());

        verify(metrics).recordZonesCreated(SYMBOL, Timeframe.M5, 1);
        verify(metrics).setActiveZones(SYMBOL, Timeframe.M5, 1);
    }

    @Test
    void onCandleClose_repeatedWindowDoesNotDuplicate() {
        disablePlugins();
        List<Candle> candles = swingLowSeries(Timeframe.M5, 100);
        map.onCandleClose(Timeframe.M5, candles, 100.0);

        RefreshResult again = map.onCandleClose(Timeframe.M5, candles, 100.0);

        assertEquals(0, again.created());
        assertEquals(0, again.merged());
        assertEquals(1, again.activeZones());
        assertEquals(0, map.getZones(Timeframe.M5, ZoneFilter.all()).get(0).touchCount(),
            "same closed candle is applied once");
    }

    @Test
    void onCandleClose_touchThenMitigation() {
        // Arrange
        disablePlugins();
        Timeframe tf = Timeframe.M5;
        List<Candle> candles = swingLowSeries(tf, 100);
        map.onCandleClose(tf, candles, 100.0);

        // Act: trade into the zone, then close below it
        candles = append(candles, doji(tf, ts(tf, 11), 99.0, 99.5, 98.05, 10));
        map.onCandleClose(tf, candles, 99.0);
        LiquidityZone touched = map.getZones(tf, ZoneFilter.all()).get(0);

        candles = append(candles, doji(tf, ts(tf, 12), 97.5, 98.0, 97.4, 10));
        map.onCandleClose(tf, candles, 97.5);

        // Assert
        assertEquals(1, touched.touchCount());
        assertFalse(touched.mitigated());
        assertTrue(map.getZones(tf, ZoneFilter.active()).isEmpty(), "mitigated zones are hidden by default");
        List<LiquidityZone> all = map.getZones(tf, ZoneFilter.all());
        assertEquals(1, all.size());
        assertTrue(all.get(0).mitigated());
    }

    @Test
    void onCandleClose_weakOriginVolumeIsFiltered() {
        disablePlugins();

        RefreshResult result = map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 10), 100.0);

        assertEquals(1, result.candidates());
        assertEquals(0, result.created());
        assertEquals(1, map.getStatistics().volumeFiltered());
        verify(metrics).recordFiltered(SYMBOL, Timeframe.M5, FilterStage.VOLUME, 1);
    }

    @Test
    void onCandleClose_zoneTooCloseToPriceIsFiltered() {
        disablePlugins();

        RefreshResult result = map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 98.05);

        assertEquals(0, result.created());
        assertEquals(1, map.getStatistics().distanceFiltered());
        verify(metrics).recordFiltered(SYMBOL, Timeframe.M5, FilterStage.DISTANCE, 1);
    }

    @Test
    void onCandleClose_oldZonesAgeOut() {
        // Arrange
        disablePlugins();
        map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);

        // Act: 200 intervals later the zone is older than the 100-candle limit
        RefreshResult result = map.onCandleClose(Timeframe.M5,
            flat(Timeframe.M5, ts(Timeframe.M5, 200), 11, 100.0, 1.0, 10), 100.0);

        // Assert
        assertEquals(1, result.aged());
        assertEquals(0, result.activeZones());
        assertEquals(1, map.getStatistics().ageFiltered());
        verify(metrics).recordFiltered(SYMBOL, Timeframe.M5, FilterStage.AGE, 1);
    }

    @Test
    void onCandleClose_extremeVolatilitySkipsDetection() {
        // Arrange: a detectable swing low, 15 candles ranging 2.0, then 14 ranging 0.02
        disablePlugins();
        List<Candle> candles = new ArrayList<>(swingLowSeries(Timeframe.M5, 100));
        candles.addAll(flat(Timeframe.M5, ts(Timeframe.M5, 11), 15, 100.0, 1.0, 10));
        List<Candle> calm = List.copyOf(candles);
        candles.addAll(flat(Timeframe.M5, ts(Timeframe.M5, 26), 14, 100.0, 0.01, 10));

        // Act
        RefreshResult result = map.onCandleClose(Timeframe.M5, candles, 100.0);
        LiquidityMap control = new LiquidityMap(SYMBOL, TimeframeConfigService.withDefaults(),
            EnumSet.of(Timeframe.M5), null);
        for (String name : PLUGINS) {
            control.disablePlugin(name);
        }
        RefreshResult ungated = control.onCandleClose(Timeframe.M5, calm, 100.0);

        // Assert
        assertFalse(result.detectionRan());
        assertEquals(Volatility.LOW, result.volatility());
        assertTrue(result.skipReason().contains("volatility"));
        assertEquals(0, result.activeZones(), "swing low is in the window but detection was skipped");
        assertEquals(1, map.getStatistics().atrFiltered());
        verify(metrics).recordFiltered(SYMBOL, Timeframe.M5, FilterStage.ATR, 1);
        verify(metrics, never()).recordZonesCreated(any(), any(), anyInt());

        assertTrue(ungated.detectionRan());
        assertEquals(1, ungated.created(), "same swing low is detected without the volatility collapse");
    }

    @Test
    void onCandleClose_malformedPatternCandleDoesNotAbortRefresh() {
        // Arrange: the bearish candle before the impulse has high < low
        disablePlugins();
        map.enablePlugin(OrderBlockPlugin.NAME);
        Timeframe tf = Timeframe.M5;
        List<Candle> candles = new ArrayList<>(flat(tf, START, 20, 100.0, 0.5, 10));
        candles.add(candle(tf, ts(tf, 20), 100.5, 99.0, 101.0, 100.0, 10));
        candles.add(candle(tf, ts(tf, 21), 100.0, 103.2, 99.9, 103.0, 10));
        candles.addAll(flat(tf, ts(tf, 22), 4, 103.0, 0.5, 10));

        // Act
        RefreshResult result = map.onCandleClose(tf, candles, 103.0);

        // Assert
        assertTrue(result.detectionRan());
        assertEquals(1, map.getPlugin(tf, OrderBlockPlugin.class).getAll().size(), "block itself is stored");
        assertTrue(map.getZones(tf, ZoneFilter.builder().kind(ZoneKind.ORDER_BLOCK).build()).isEmpty(),
            "no zone for a block with inverted bounds");
        assertTrue(map.getPremiumDiscount(tf).isPresent(), "refresh ran to completion");
    }

    @Test
    void onCandleClose_rejectsBadInput() {
        List<Candle> candles = swingLowSeries(Timeframe.M5, 100);

        assertEquals("no candles", map.onCandleClose(Timeframe.M5, List.of(), 100.0).skipReason());
        assertEquals("invalid price", map.onCandleClose(Timeframe.M5, candles, 0.0).skipReason());
        assertEquals("invalid price", map.onCandleClose(Timeframe.M5, candles, Double.NaN).skipReason());
        assertEquals("insufficient candles",
            map.onCandleClose(Timeframe.M5, candles.subList(0, 5), 100.0).skipReason());
        assertThrows(IllegalArgumentException.class,
            () -> map.onCandleClose(Timeframe.H1, candles, 100.0), "1h is not tracked");
        assertNull(map.onCandleClose(Timeframe.M5, candles, 100.0).skipReason());
    }

    @Test
    void getConfluenceZones_groupsTimeframesAtSamePrice() {
        // Arrange
        disablePlugins();
        map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);
        map.onCandleClose(Timeframe.M15, swingLowSeries(Timeframe.M15, 100), 100.0);

        // Act
        List<LiquidityZone> confluence = map.getConfluenceZones(2);
        Map<Timeframe, List<LiquidityZone>> all = map.getAllZones(ZoneFilter.builder().side(ZoneSide.SUPPORT).build());

        // Assert
        assertEquals(1, confluence.size());
        assertEquals(5, confluence.get(0).confluenceWeight(), "15m + 5m = 3 + 2");
        assertEquals(Timeframe.M15, confluence.get(0).timeframe());
        assertEquals(2, all.size());
        assertEquals(1, all.get(Timeframe.M5).size());
        assertEquals(1, all.get(Timeframe.M15).size());
        assertTrue(map.getConfluenceZones(3).isEmpty());
    }

    @Test
    void pluginControl() {
        // Act
        map.disablePlugin(FairValueGapPlugin.NAME);

        // Assert
        List<PluginStatus> status = map.getPluginStatus(Timeframe.M5);
        assertEquals(6, status.size());
        assertEquals(OrderBlockPlugin.NAME, status.get(0).name());
        for (PluginStatus s : status) {
            assertEquals(!s.name().equals(FairValueGapPlugin.NAME), s.enabled(), s.name());
        }
        assertFalse(map.getPlugin(Timeframe.M15, FairValueGapPlugin.class).isEnabled());

        map.enablePlugin(FairValueGapPlugin.NAME);
        assertTrue(map.getPlugin(Timeframe.M5, FairValueGapPlugin.class).isEnabled());
        assertThrows(IllegalArgumentException.class, () -> map.disablePlugin("wyckoff"));
    }

    @Test
    void clearAndResetStatistics() {
        disablePlugins();
        map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);

        map.clear(Timeframe.M5);
        map.resetStatistics();

        assertTrue(map.getZones(Timeframe.M5, ZoneFilter.all()).isEmpty());
        assertEquals(0, map.getStatistics().totalZonesCreated());
        assertEquals(0, map.getStatistics().totalFiltered());
        verify(metrics).setActiveZones(eq(SYMBOL), eq(Timeframe.M5), eq(0));

        RefreshResult again = map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);
        assertEquals(1, again.created(), "cleared timeframe detects from scratch");
    }

    @Test
    void onCandleClose_repeatedTouchesRerateZoneStrong() {
        // Arrange
        disablePlugins();
        Timeframe tf = Timeframe.M5;
        List<Candle> candles = swingLowSeries(tf, 100);
        map.onCandleClose(tf, candles, 100.0);
        List<ZoneStrength> seen = new ArrayList<>();

        // Act: three candles trading into the zone without closing below it
        for (int i = 11; i <= 13; i++) {
            candles = append(candles, doji(tf, ts(tf, i), 99.0, 99.5, 98.05, 10));
            map.onCandleClose(tf, candles, 99.0);
            seen.add(map.getZones(tf, ZoneFilter.all()).get(0).strength());
        }

        // Assert
        assertEquals(List.of(ZoneStrength.MODERATE, ZoneStrength.MODERATE, ZoneStrength.STRONG), seen);
        assertEquals(3, map.getZones(tf, ZoneFilter.all()).get(0).touchCount());
        assertEquals(1, map.getZones(tf, ZoneFilter.builder().minStrength(ZoneStrength.STRONG).build()).size());
    }

    @Test
    void onCandleClose_concurrentRefreshesOfOneTimeframeCreateOneZone() throws Exception {
        // Arrange
        disablePlugins();
        List<Candle> candles = swingLowSeries(Timeframe.M5, 100);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // Act
        List<Future<RefreshResult>> results = new ArrayList<>();
        for (int t = 0; t < 2; t++) {
            results.add(pool.submit(() -> {
                start.await();
                return map.onCandleClose(Timeframe.M5, candles, 100.0);
            }));
        }
        start.countDown();
        int created = 0;
        for (Future<RefreshResult> f : results) {
            created += f.get(5, TimeUnit.SECONDS).created();
        }
        pool.shutdown();

        // Assert
        assertEquals(1, created, "one of the two refreshes creates the zone");
        assertEquals(1, map.getZones(Timeframe.M5, ZoneFilter.all()).size());
        assertEquals(1, map.getStatistics().totalZonesCreated());
        verify(metrics).recordZonesCreated(SYMBOL, Timeframe.M5, 1);
    }

    @Test
    void getConfluenceGroups_readerSeesConsistentGroupsDuringRefreshes() throws Exception {
        // Arrange
        disablePlugins();
        List<Candle> m5 = swingLowSeries(Timeframe.M5, 100);
        List<Candle> m15 = swingLowSeries(Timeframe.M15, 100);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // Act
        Future<?> writer = pool.submit(() -> {
            for (int round = 0; round < 200; round++) {
                map.onCandleClose(Timeframe.M5, m5, 100.0);
                map.onCandleClose(Timeframe.M15, m15, 100.0);
                if (round % 2 == 0) {
                    map.clear(Timeframe.M5);
                }
            }
        });
        Future<Integer> reader = pool.submit(() -> {
            int reads = 0;
            while (!writer.isDone() || reads == 0) {
                for (ConfluenceZone group : map.getConfluenceGroups(1)) {
                    assertFalse(group.members().isEmpty());
                    assertEquals(group.timeframes().size(), group.members().stream()
                        .map(LiquidityZone::timeframe).distinct().count());
                    assertEquals(group.confluenceWeight(), group.representative().confluenceWeight());
                    int weight = group.confluenceWeight();
                    assertTrue(weight == 2 || weight == 3 || weight == 5, "5m, 15m or both: " + weight);
                }
                reads++;
            }
            return reads;
        });

        // Assert
        writer.get(10, TimeUnit.SECONDS);
        assertTrue(reader.get(10, TimeUnit.SECONDS) > 0);
        pool.shutdown();
        assertEquals(1, map.getZones(Timeframe.M15, ZoneFilter.all()).size());
    }

    @Test
    void getDisplacements_filtersAndRanksRuns() {
        // Arrange
        disablePlugins();
        Timeframe tf = Timeframe.M5;
        map.onCandleClose(tf, twoDisplacements(tf), 100.0);

        // Act
        List<Displacement> all = map.getDisplacements(tf, null, 3);
        List<Displacement> bullish = map.getDisplacements(tf, PatternDirection.BULLISH, 3);

        // Assert
        assertEquals(2, all.size());
        assertEquals(PatternDirection.BEARISH, all.get(0).direction(), "newest first");
        assertEquals(ts(tf, 27), all.get(0).endTs());
        assertEquals(1, bullish.size());
        Displacement up = bullish.get(0);
        assertEquals(ts(tf, 20), up.startTs());
        assertEquals(3, up.candleCount());
        assertEquals(3.0, up.movePct(), 1e-9);
        assertFalse(up.isStrong(), "three candles are below the strong threshold");

        assertTrue(map.getDisplacements(tf, null, 4).isEmpty());
        assertEquals(all.subList(0, 1), map.getRecentDisplacements(tf, 1));
        assertEquals(up, map.getStrongestDisplacement(tf, DisplacementMetric.MOVE_PCT).orElseThrow());
        assertEquals(2, map.getDisplacements(null, null, 0).size(), "15m has none");
        assertTrue(map.getStrongestDisplacement(Timeframe.M15, DisplacementMetric.CANDLE_COUNT).isEmpty());

        map.clear(tf);
        assertTrue(map.getDisplacements(tf, null, 0).isEmpty());
    }

    @Test
    void getPremiumDiscount_classifiesZonesAgainstLastWindow() {
        // Arrange
        disablePlugins();
        assertTrue(map.getPremiumDiscount(Timeframe.M5).isEmpty(), "no refresh yet");

        // Act
        map.onCandleClose(Timeframe.M5, swingLowSeries(Timeframe.M5, 100), 100.0);

        // Assert
        PremiumDiscount pd = map.getPremiumDiscount(Timeframe.M5).orElseThrow();
        assertEquals(98.0, pd.rangeLow(), 1e-12);
        assertEquals(101.0, pd.rangeHigh(), 1e-12);
        LiquidityZone support = map.getZones(Timeframe.M5, ZoneFilter.all()).get(0);
        assertEquals(PdPosition.DISCOUNT, map.getPdPosition(support).orElseThrow());
        assertEquals(PdPosition.PREMIUM, pd.classify(100.5));
        assertTrue(map.getPremiumDiscount(Timeframe.M15).isEmpty());
    }

    @Test
    void getStructureTrend_followsBreaksOfStructure() {
        // Arrange: swing high at 5, swing low at 10, closes above both swing highs at 11 and 17
        disablePlugins();
        map.enablePlugin(StructureBreakPlugin.NAME);
        double[] prices = {
            100.0, 100.5, 101.0, 101.5, 102.0, 106.0, 103.0, 102.0, 101.0,
            100.0, 99.5, 107.0, 104.0, 103.5, 103.0, 102.5, 102.0, 108.0
        };
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            candles.add(doji(Timeframe.M15, ts(Timeframe.M15, i), prices[i], prices[i] + 0.5, prices[i] - 0.5, 10));
        }
        TrendDirection before = map.getStructureTrend(Timeframe.M15);

        // Act
        map.onCandleClose(Timeframe.M15, candles, 108.0);

        // Assert
        assertEquals(TrendDirection.RANGING, before);
        assertEquals(TrendDirection.UP, map.getStructureTrend(Timeframe.M15));
        assertEquals(TrendDirection.RANGING, map.getStructureTrend(Timeframe.M5));
    }

    @Test
    void getLiquiditySweeps_sweepThenReversal() {
        // Arrange: equal highs near 101.025 (0, 2), equal lows near 98.025 (1, 3), unclustered filler
        disablePlugins();
        map.enablePlugin(LiquidityLevelPlugin.NAME);
        map.enablePlugin(LiquiditySweepPlugin.NAME);
        Timeframe tf = Timeframe.M5;
        List<Candle> candles = new ArrayList<>(List.of(
            bar(tf, 0, 101.0, 99.0), bar(tf, 1, 100.5, 98.0), bar(tf, 2, 101.05, 98.5),
            bar(tf, 3, 100.2, 98.05), bar(tf, 4, 100.8, 99.3), bar(tf, 5, 100.65, 99.15),
            bar(tf, 6, 100.35, 98.75), bar(tf, 7, 99.9, 99.5), bar(tf, 8, 99.6, 98.3)));
        map.onCandleClose(tf, candles, 99.0);

        // Act: wick through the highs, then trade back under them
        candles = append(candles, bar(tf, 9, 101.3, 99.8));
        map.onCandleClose(tf, candles, 100.5);
        List<LiquiditySweep> afterWick = map.getLiquiditySweeps(tf, false);
        candles = append(candles, bar(tf, 10, 101.0, 100.5));
        map.onCandleClose(tf, candles, 100.6);

        // Assert
        assertTrue(afterWick.isEmpty(), "the sweep is picked up on the refresh after the level is swept");
        List<LiquiditySweep> confirmed = map.getLiquiditySweeps(tf, true);
        assertEquals(1, confirmed.size());
        LiquiditySweep sweep = confirmed.get(0);
        assertEquals(SweepType.BUY_SIDE, sweep.type());
        assertEquals(ts(tf, 9), sweep.sweepTs());
        assertEquals(101.025, sweep.levelPrice(), 1e-9);
        assertEquals(ts(tf, 10), sweep.reversalTs());
    }
}

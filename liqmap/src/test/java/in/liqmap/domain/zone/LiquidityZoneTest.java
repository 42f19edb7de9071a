package in.liqmap.domain.zone;

import in.liqmap.domain.data.Timeframe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiquidityZoneTest {

    private static LiquidityZone zone(double low, double high) {
        return LiquidityZone.of("z", Timeframe.M15, ZoneKind.SUPPORT, ZoneSide.SUPPORT, low, high,
            9_000, ZoneStrength.MODERATE, 1.0);
    }

    @Test
    void testInvertedBoundsRejected() {
        assertThrows(IllegalArgumentException.class, () -> zone(101.0, 100.0));
        assertThrows(IllegalArgumentException.class, () -> zone(Double.NaN, 100.0));
    }

    @Test
    void testGeometry() {
        LiquidityZone z = zone(99.0, 101.0);

        assertEquals(100.0, z.midpoint(), 1e-12);
        assertEquals(2.0, z.width(), 1e-12);
        assertTrue(z.contains(101.0));
        assertFalse(z.contains(101.01));
        assertEquals(3, z.ageInCandles(9_000 + 3 * 900 + 899));
    }

    @Test
    void testOverlapHonoursRadius() {
        LiquidityZone a = zone(100.0, 100.2);
        LiquidityZone b = zone(100.4, 100.6);

        assertFalse(a.overlapsWithin(b, 0.0005), "0.05 + 0.05 padding leaves a gap of 0.1");
        assertTrue(a.overlapsWithin(b, 0.0015), "0.15 + 0.15 padding bridges the 0.2 gap");
    }

    @Test
    void testCopiesLeaveOriginalUntouched() {
        LiquidityZone z = zone(99.0, 101.0);

        LiquidityZone touched = z.withTouchCount(3).withMitigated(true).withConfluenceWeight(7);

        assertEquals(0, z.touchCount());
        assertFalse(z.mitigated());
        assertEquals(3, touched.touchCount());
        assertTrue(touched.mitigated());
        assertEquals(7, touched.confluenceWeight());
        assertThrows(IllegalArgumentException.class, () -> z.withTouchCount(-1));
    }
}

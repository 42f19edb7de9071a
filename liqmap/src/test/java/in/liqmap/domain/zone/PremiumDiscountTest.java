package in.liqmap.domain.zone;

import in.liqmap.domain.data.Timeframe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PremiumDiscountTest {

    private final PremiumDiscount range = new PremiumDiscount(Timeframe.H1, 100.0, 200.0);

    @Test
    void classify_bandAroundHalfOfRange() {
        assertEquals(PdPosition.PREMIUM, range.classify(170.0));
        assertEquals(PdPosition.PREMIUM, range.classify(155.5));
        assertEquals(PdPosition.EQUILIBRIUM, range.classify(154.5));
        assertEquals(PdPosition.EQUILIBRIUM, range.classify(150.0));
        assertEquals(PdPosition.EQUILIBRIUM, range.classify(145.5));
        assertEquals(PdPosition.DISCOUNT, range.classify(144.5));
        assertEquals(PdPosition.DISCOUNT, range.classify(90.0), "below the range is still discount");
    }

    @Test
    void equilibriumDistancePct_signedShareOfRange() {
        assertEquals(150.0, range.equilibrium(), 1e-12);
        assertEquals(20.0, range.equilibriumDistancePct(170.0), 1e-9);
        assertEquals(-30.0, range.equilibriumDistancePct(120.0), 1e-9);
    }

    @Test
    void zeroRange_isEquilibrium() {
        PremiumDiscount flat = new PremiumDiscount(Timeframe.H1, 100.0, 100.0);

        assertEquals(PdPosition.EQUILIBRIUM, flat.classify(120.0));
        assertEquals(0.0, flat.equilibriumDistancePct(120.0));
    }

    @Test
    void invertedRange_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PremiumDiscount(Timeframe.H1, 101.0, 100.0));
    }
}

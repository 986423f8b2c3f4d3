package org.chargenet.simulate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PolynomialChargeCurve Tests")
class PolynomialChargeCurveTest {
    private final PolynomialChargeCurve curve = PolynomialChargeCurve.generic();

    @Test
    @DisplayName("Generic curve takes about 63 minutes from empty to full")
    void testGenericEndpoints() {
        assertEquals(0.0d, curve.secondsToCharge(0.0d));
        assertEquals(3_774.17d, curve.secondsToCharge(1.0d), 1e-6d);
        assertEquals(1_000.32d, curve.secondsToCharge(0.5d), 1e-2d);
    }

    @Test
    @DisplayName("Curve is non-decreasing across and beyond the unit interval")
    void testMonotonic() {
        double previous = curve.secondsToCharge(-0.5d);
        for (int i = -50; i <= 150; i++) {
            double value = curve.secondsToCharge(i / 100.0d);
            assertTrue(value >= previous, "decreasing at " + i / 100.0d);
            previous = value;
        }
    }

    @Test
    @DisplayName("Levels below empty clamp to zero and levels above full extrapolate linearly")
    void testOutOfRange() {
        assertEquals(0.0d, curve.secondsToCharge(-0.2d));
        double slope = curve.secondsToCharge(1.2d) - curve.secondsToCharge(1.1d);
        assertEquals(slope, curve.secondsToCharge(1.1d) - curve.secondsToCharge(1.0d), 1e-6d);
        assertEquals(1_692.707d, slope, 1e-3d);
    }

    @Test
    @DisplayName("Charge time between two levels is the curve difference")
    void testChargeSeconds() {
        assertEquals(curve.secondsToCharge(0.8d) - curve.secondsToCharge(0.2d), curve.chargeSeconds(0.2d, 0.8d));
    }

    @Test
    @DisplayName("Linear curve evaluates exactly")
    void testLinearCurve() {
        PolynomialChargeCurve linear = new PolynomialChargeCurve(3_600.0d);

        assertEquals(1_800.0d, linear.secondsToCharge(0.5d));
        assertEquals(3_960.0d, linear.secondsToCharge(1.1d), 1e-9d);
    }

    @Test
    @DisplayName("Empty, non-finite and decreasing-at-full coefficients are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PolynomialChargeCurve());
        assertThrows(IllegalArgumentException.class, () -> new PolynomialChargeCurve(1.0d, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new PolynomialChargeCurve(1.0d, -1.0d));
    }
}

package org.chargenet.simulate;

import java.util.Arrays;
import java.util.Objects;

/**
 * Polynomial charge curve {@code t(x) = c1*x + c2*x^2 + ... + cn*x^n} with no constant
 * term, so {@code t(0) == 0}.
 *
 * <p>Inside {@code [0, 1]} the polynomial is evaluated directly. Below {@code 0} the
 * level is clamped to {@code 0}; above {@code 1} the curve continues linearly with
 * its slope at {@code 1}, keeping over-capacity charge targets finite and monotonic.</p>
 */
public final class PolynomialChargeCurve implements ChargeCurve {
    /**
     * Fast-charge profile fitted to a typical DC charging session (about 63 minutes
     * from empty to full).
     */
    private static final double[] GENERIC_COEFFICIENTS = {3618.27d, -17215.3d, 55352.6d, -71588.6d, 33607.2d};

    private final double[] coefficients;
    private final double valueAtFull;
    private final double slopeAtFull;

    /**
     * @param coefficients {@code c1..cn} in ascending power order.
     * @throws IllegalArgumentException when empty, non-finite, or the slope at full is negative.
     */
    public PolynomialChargeCurve(double... coefficients) {
        Objects.requireNonNull(coefficients, "coefficients");
        if (coefficients.length == 0) {
            throw new IllegalArgumentException("at least one coefficient is required");
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("coefficients must be finite: " + Arrays.toString(coefficients));
            }
        }
        this.coefficients = coefficients.clone();
        this.valueAtFull = evaluate(1.0d);
        this.slopeAtFull = derivative(1.0d);
        if (slopeAtFull < 0.0d) {
            throw new IllegalArgumentException("curve must be non-decreasing at full charge, slope=" + slopeAtFull);
        }
    }

    /**
     * Returns the default fast-charge curve.
     */
    public static PolynomialChargeCurve generic() {
        return new PolynomialChargeCurve(GENERIC_COEFFICIENTS);
    }

    @Override
    public double secondsToCharge(double level) {
        if (level <= 0.0d) {
            return 0.0d;
        }
        if (level <= 1.0d) {
            return evaluate(level);
        }
        return valueAtFull + slopeAtFull * (level - 1.0d);
    }

    private double evaluate(double x) {
        // Horner over c1..cn, then one extra multiply for the missing constant term
        double acc = 0.0d;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            acc = acc * x + coefficients[i];
        }
        return acc * x;
    }

    private double derivative(double x) {
        double acc = 0.0d;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            acc = acc * x + (i + 1) * coefficients[i];
        }
        return acc;
    }
}

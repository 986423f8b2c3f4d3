package org.chargenet.routing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Inclusive driving-distance window, in meters, a leg must fall into to be used
 * by a path query.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LegLengthWindow {
    double minMeters;
    double maxMeters;

    /**
     * @throws IllegalArgumentException when a bound is NaN or negative, or {@code min > max}.
     */
    public static LegLengthWindow of(double minMeters, double maxMeters) {
        if (Double.isNaN(minMeters) || Double.isNaN(maxMeters)) {
            throw new IllegalArgumentException("leg length bounds must not be NaN");
        }
        if (minMeters < 0.0d) {
            throw new IllegalArgumentException("minMeters must be >= 0, got " + minMeters);
        }
        if (minMeters > maxMeters) {
            throw new IllegalArgumentException("minMeters " + minMeters + " exceeds maxMeters " + maxMeters);
        }
        return new LegLengthWindow(minMeters, maxMeters);
    }

    /**
     * Window that admits every leg.
     */
    public static LegLengthWindow unbounded() {
        return new LegLengthWindow(0.0d, Double.POSITIVE_INFINITY);
    }

    public boolean admits(double drivingDistanceMeters) {
        return drivingDistanceMeters >= minMeters && drivingDistanceMeters <= maxMeters;
    }
}

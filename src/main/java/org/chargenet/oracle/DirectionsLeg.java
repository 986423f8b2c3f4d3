package org.chargenet.oracle;

import lombok.Value;

/**
 * Road distance and duration between two consecutive waypoints.
 */
@Value(staticConstructor = "of")
public class DirectionsLeg {
    double distanceMeters;
    double durationSeconds;

    /**
     * Whether both values are finite and non-negative.
     */
    public boolean isWellFormed() {
        return Double.isFinite(distanceMeters) && distanceMeters >= 0.0d
                && Double.isFinite(durationSeconds) && durationSeconds >= 0.0d;
    }
}

package org.chargenet.simulate;

import lombok.Value;
import org.chargenet.network.Leg;

/**
 * Driving distance and time of one leg as fed into {@link PathSimulator}.
 */
@Value(staticConstructor = "of")
public class LegMeasurement {
    double distanceMeters;
    double timeSeconds;

    /**
     * Measurement taken from a graph leg's stored values.
     */
    public static LegMeasurement fromLeg(Leg leg) {
        return of(leg.drivingDistanceMeters(), leg.drivingTimeSeconds());
    }
}

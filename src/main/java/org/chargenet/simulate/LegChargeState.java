package org.chargenet.simulate;

import lombok.Builder;
import lombok.Value;

/**
 * Battery and charging state at the station that begins one leg of a path.
 */
@Value
@Builder
public class LegChargeState {
    /** Road distance of the leg in meters. */
    double drivingDistanceMeters;
    /** Driving time of the leg in seconds. */
    double drivingTimeSeconds;
    /** Seconds spent charging before departing on this leg. */
    double chargeTimeSeconds;
    /** Battery level on arrival at the leg's start station. */
    double batteryStart;
    /** Battery level when departing on the leg. */
    double batteryEnd;

    /**
     * Whether charging happened at this station.
     */
    public boolean charged() {
        return chargeTimeSeconds > 0.0d || batteryEnd > batteryStart;
    }

    /**
     * Whether the departure level exceeds a full battery. Happens when the driving
     * distance reported for the trip is longer than the distance the path was planned with.
     */
    public boolean overCapacity() {
        return batteryEnd > 1.0d;
    }
}

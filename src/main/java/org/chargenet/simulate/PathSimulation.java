package org.chargenet.simulate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Battery-state timeline of a simulated path.
 */
@Value
@Builder
public class PathSimulation {
    /** One state per leg, in travel order. */
    @Singular
    List<LegChargeState> legStates;
    /** Battery level on arrival at the destination. */
    double arrivalBattery;
    /** Sum of leg driving distances in meters. */
    double totalDrivingDistanceMeters;
    /** Sum of leg driving times in seconds. */
    double totalDrivingTimeSeconds;
    /** Sum of charging times in seconds. */
    double totalChargeTimeSeconds;

    /**
     * Driving plus charging time in seconds.
     */
    public double totalTimeSeconds() {
        return totalDrivingTimeSeconds + totalChargeTimeSeconds;
    }

    /**
     * Number of stops where the vehicle charged.
     */
    public int chargeStops() {
        int stops = 0;
        for (LegChargeState state : legStates) {
            if (state.charged()) {
                stops++;
            }
        }
        return stops;
    }
}

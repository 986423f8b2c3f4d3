package org.chargenet.simulate;

import lombok.experimental.UtilityClass;
import org.chargenet.network.Leg;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts a sequence of driving legs into a battery-state timeline.
 *
 * <p>At every station the vehicle charges only as much as it needs to finish the
 * next leg at the battery floor. No charging happens when the level on arrival is
 * already enough.</p>
 */
@UtilityClass
public final class PathSimulator {

    /**
     * Simulates graph legs using their stored distance and time.
     */
    public static PathSimulation simulateLegs(List<Leg> legs, BatteryProfile profile, ChargeCurve curve) {
        Objects.requireNonNull(legs, "legs");
        List<LegMeasurement> measurements = new ArrayList<>(legs.size());
        for (Leg leg : legs) {
            measurements.add(LegMeasurement.fromLeg(leg));
        }
        return simulate(measurements, profile, curve);
    }

    /**
     * Simulates charging along {@code legs}, in travel order.
     *
     * @throws IllegalArgumentException when {@code legs} is empty or the profile is invalid.
     */
    public static PathSimulation simulate(List<LegMeasurement> legs, BatteryProfile profile, ChargeCurve curve) {
        Objects.requireNonNull(legs, "legs");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(curve, "curve");
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("cannot simulate an empty path");
        }
        profile.validate();

        PathSimulation.PathSimulationBuilder result = PathSimulation.builder();
        double batteryStart = profile.getStartBattery();
        double drivingMeters = 0.0d;
        double drivingSeconds = 0.0d;
        double chargeSeconds = 0.0d;
        double batteryEnd = batteryStart;
        double lastConsumption = 0.0d;

        for (int i = 0; i < legs.size(); i++) {
            LegMeasurement leg = Objects.requireNonNull(legs.get(i), "legs[" + i + "]");
            if (i > 0) {
                batteryStart = batteryEnd - lastConsumption;
            }
            lastConsumption = profile.consumption(leg.getDistanceMeters());
            double required = profile.getMinBattery() + lastConsumption;

            double legChargeSeconds = 0.0d;
            batteryEnd = batteryStart;
            if (batteryStart < required) {
                legChargeSeconds = Math.max(0.0d, curve.chargeSeconds(batteryStart, required));
                batteryEnd = required;
            }

            result.legState(LegChargeState.builder()
                    .drivingDistanceMeters(leg.getDistanceMeters())
                    .drivingTimeSeconds(leg.getTimeSeconds())
                    .chargeTimeSeconds(legChargeSeconds)
                    .batteryStart(batteryStart)
                    .batteryEnd(batteryEnd)
                    .build());
            drivingMeters += leg.getDistanceMeters();
            drivingSeconds += leg.getTimeSeconds();
            chargeSeconds += legChargeSeconds;
        }

        return result
                .arrivalBattery(batteryEnd - lastConsumption)
                .totalDrivingDistanceMeters(drivingMeters)
                .totalDrivingTimeSeconds(drivingSeconds)
                .totalChargeTimeSeconds(chargeSeconds)
                .build();
    }
}

package org.chargenet.trip;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.chargenet.core.geo.Coordinate;
import org.chargenet.simulate.BatteryProfile;

/**
 * A trip query: two coordinates and the vehicle's battery constraints.
 *
 * <p>Battery levels are fractions of a full battery; distances are meters.</p>
 */
@Value
@Builder
public class TripRequest {
    @NonNull
    Coordinate start;
    @NonNull
    Coordinate end;

    /**
     * Shortest leg the path may use. Keeps the planner from stopping at every station.
     */
    @Builder.Default
    double minLegMeters = 250_000.0d;

    /**
     * Full-battery range of the vehicle.
     */
    @Builder.Default
    double evRangeMeters = 550_000.0d;

    @Builder.Default
    double minBattery = 0.15d;

    @Builder.Default
    double maxBattery = 1.0d;

    @Builder.Default
    double startBattery = 0.40d;

    /**
     * Longest leg the vehicle can drive between the battery floor and ceiling.
     */
    public double effectiveRangeMeters() {
        return (maxBattery - minBattery) * evRangeMeters;
    }

    /**
     * Validates the battery and leg-length rules and returns {@code this}.
     *
     * @throws IllegalArgumentException when a rule is violated.
     */
    public TripRequest validate() {
        if (!Double.isFinite(evRangeMeters) || evRangeMeters <= 0.0d) {
            throw new IllegalArgumentException("evRangeMeters must be finite and > 0, got " + evRangeMeters);
        }
        if (!(minBattery >= 0.0d && minBattery <= maxBattery && maxBattery <= 1.0d)) {
            throw new IllegalArgumentException(
                    "battery levels must satisfy 0 <= minBattery <= maxBattery <= 1, got min="
                            + minBattery + " max=" + maxBattery);
        }
        if (!(startBattery >= 0.0d && startBattery <= 1.0d)) {
            throw new IllegalArgumentException("startBattery must be in [0, 1], got " + startBattery);
        }
        if (!(minLegMeters >= 0.0d)) {
            throw new IllegalArgumentException("minLegMeters must be >= 0, got " + minLegMeters);
        }
        if (minLegMeters > effectiveRangeMeters()) {
            throw new IllegalArgumentException("minLegMeters " + minLegMeters
                    + " exceeds the effective range " + effectiveRangeMeters());
        }
        return this;
    }

    /**
     * Battery profile used for the charging simulation.
     */
    public BatteryProfile batteryProfile() {
        return BatteryProfile.builder()
                .evRangeMeters(evRangeMeters)
                .minBattery(minBattery)
                .startBattery(startBattery)
                .build();
    }
}

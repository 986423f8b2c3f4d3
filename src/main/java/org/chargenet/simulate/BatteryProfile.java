package org.chargenet.simulate;

import lombok.Builder;
import lombok.Value;

/**
 * Vehicle battery parameters for a charging simulation.
 */
@Value
@Builder
public class BatteryProfile {
    /**
     * Distance in meters a full battery drives.
     */
    double evRangeMeters;

    /**
     * Battery floor the vehicle must never arrive below.
     */
    @Builder.Default
    double minBattery = 0.15d;

    /**
     * Battery level when leaving the first station.
     */
    @Builder.Default
    double startBattery = 0.40d;

    /**
     * Validates ranges and returns {@code this}.
     *
     * @throws IllegalArgumentException when a field is out of range.
     */
    public BatteryProfile validate() {
        if (!Double.isFinite(evRangeMeters) || evRangeMeters <= 0.0d) {
            throw new IllegalArgumentException("evRangeMeters must be finite and > 0, got " + evRangeMeters);
        }
        if (!(minBattery >= 0.0d && minBattery <= 1.0d)) {
            throw new IllegalArgumentException("minBattery must be in [0, 1], got " + minBattery);
        }
        if (!(startBattery >= 0.0d) || !Double.isFinite(startBattery)) {
            throw new IllegalArgumentException("startBattery must be finite and >= 0, got " + startBattery);
        }
        return this;
    }

    /**
     * Battery fraction consumed by driving {@code meters}.
     */
    public double consumption(double meters) {
        return meters / evRangeMeters;
    }
}

package org.chargenet.network;

import java.util.Objects;

/**
 * Resolved driving leg between two charge stations.
 *
 * <p>Immutable once built. Equality is inherited from the endpoint pair alone:
 * two legs over the same stations are the same edge regardless of the distance
 * or time they carry.</p>
 */
public final class Leg {
    private final StationPair endpoints;
    private final double drivingDistanceMeters;
    private final double drivingTimeSeconds;

    /**
     * @param endpoints unordered station pair.
     * @param drivingDistanceMeters road distance, finite and {@code >= 0}.
     * @param drivingTimeSeconds driving time, finite and {@code >= 0}.
     */
    public Leg(StationPair endpoints, double drivingDistanceMeters, double drivingTimeSeconds) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.drivingDistanceMeters = requireNonNegative(drivingDistanceMeters, "drivingDistanceMeters");
        this.drivingTimeSeconds = requireNonNegative(drivingTimeSeconds, "drivingTimeSeconds");
    }

    public Leg(ChargeStation first, ChargeStation second, double drivingDistanceMeters, double drivingTimeSeconds) {
        this(new StationPair(first, second), drivingDistanceMeters, drivingTimeSeconds);
    }

    public StationPair endpoints() {
        return endpoints;
    }

    public double drivingDistanceMeters() {
        return drivingDistanceMeters;
    }

    public double drivingTimeSeconds() {
        return drivingTimeSeconds;
    }

    public boolean touches(ChargeStation station) {
        return endpoints.contains(station);
    }

    public ChargeStation otherEndpoint(ChargeStation station) {
        return endpoints.other(station);
    }

    private static double requireNonNegative(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and >= 0, got " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Leg)) {
            return false;
        }
        return endpoints.equals(((Leg) o).endpoints);
    }

    @Override
    public int hashCode() {
        return endpoints.hashCode();
    }

    @Override
    public String toString() {
        return "Leg" + endpoints + "[" + drivingDistanceMeters + " m, " + drivingTimeSeconds + " s]";
    }
}

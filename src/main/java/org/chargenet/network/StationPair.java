package org.chargenet.network;

import java.util.Objects;

/**
 * Unordered pair of two distinct stations: a candidate edge that has not been
 * resolved against the routing oracle yet.
 *
 * <p>Equality and hash are defined on the unordered identity pair, so
 * {@code (a, b)} equals {@code (b, a)} and candidate generation deduplicates
 * naturally in a set.</p>
 */
public final class StationPair {
    private final ChargeStation first;
    private final ChargeStation second;

    /**
     * @throws IllegalArgumentException when both endpoints are the same vertex.
     */
    public StationPair(ChargeStation first, ChargeStation second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        if (first == second) {
            throw new IllegalArgumentException("a pair needs two distinct stations: " + first);
        }
    }

    public ChargeStation first() {
        return first;
    }

    public ChargeStation second() {
        return second;
    }

    public boolean contains(ChargeStation station) {
        return first == station || second == station;
    }

    /**
     * Returns the endpoint that is not {@code station}.
     *
     * @throws IllegalArgumentException when {@code station} is not an endpoint.
     */
    public ChargeStation other(ChargeStation station) {
        if (station == first) {
            return second;
        }
        if (station == second) {
            return first;
        }
        throw new IllegalArgumentException(station + " is not an endpoint of " + this);
    }

    /**
     * Completes this candidate with oracle-reported values.
     */
    public Leg resolve(double drivingDistanceMeters, double drivingTimeSeconds) {
        return new Leg(this, drivingDistanceMeters, drivingTimeSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StationPair)) {
            return false;
        }
        StationPair other = (StationPair) o;
        return (first == other.first && second == other.second)
                || (first == other.second && second == other.first);
    }

    @Override
    public int hashCode() {
        // symmetric in the two endpoints
        return System.identityHashCode(first) ^ System.identityHashCode(second);
    }

    @Override
    public String toString() {
        return "{" + first + " <-> " + second + "}";
    }
}

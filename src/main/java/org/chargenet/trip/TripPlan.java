package org.chargenet.trip;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.chargenet.core.geo.Coordinate;
import org.chargenet.network.ChargeStation;
import org.chargenet.oracle.BoundingBox;
import org.chargenet.simulate.PathSimulation;

import java.util.List;

/**
 * Result of {@link TripPlanner#plan(TripRequest)}.
 */
@Value
@Builder
public class TripPlan {
    @NonNull
    TripRequest request;
    /** Every station except the destination, in travel order. */
    @Singular
    List<TripStop> stops;
    @NonNull
    ChargeStation destination;
    double arrivalBattery;
    /** Google encoded overview polyline from the routing oracle. */
    String overviewPolyline;
    /** Decoded overview polyline. */
    @Singular
    List<Coordinate> routePoints;
    BoundingBox bounds;
    @NonNull
    PathSimulation simulation;

    public double totalDrivingDistanceMeters() {
        return simulation.getTotalDrivingDistanceMeters();
    }

    public double totalDrivingTimeSeconds() {
        return simulation.getTotalDrivingTimeSeconds();
    }

    public double totalChargeTimeSeconds() {
        return simulation.getTotalChargeTimeSeconds();
    }

    public double totalTimeSeconds() {
        return simulation.totalTimeSeconds();
    }
}

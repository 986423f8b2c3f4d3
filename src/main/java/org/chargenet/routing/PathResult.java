package org.chargenet.routing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.chargenet.network.ChargeStation;
import org.chargenet.network.Leg;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one successful leg search.
 */
@Value
@Builder
public class PathResult {
    /** Origin station. */
    ChargeStation start;
    /** Destination station. */
    ChargeStation goal;
    /** Legs ordered from start to goal. */
    @Singular
    List<Leg> legs;
    /** Sum of leg driving distances in meters. */
    double totalDistanceMeters;
    /** Sum of leg driving times in seconds. */
    double totalTimeSeconds;
    /** Number of stations settled by the search. */
    int settledStations;

    /**
     * Returns every station on the path, start and goal included, in travel order.
     */
    public List<ChargeStation> stations() {
        List<ChargeStation> stations = new ArrayList<>(legs.size() + 1);
        stations.add(start);
        ChargeStation current = start;
        for (Leg leg : legs) {
            current = leg.otherEndpoint(current);
            stations.add(current);
        }
        return stations;
    }
}

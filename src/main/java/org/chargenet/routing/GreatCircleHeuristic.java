package org.chargenet.routing;

import lombok.experimental.UtilityClass;
import org.chargenet.core.geo.GeoMath;
import org.chargenet.network.ChargeStation;

import java.util.Objects;

/**
 * Great-circle heuristic for leg search.
 *
 * <p>Road distance is never shorter than the great-circle distance between the same
 * two points, so the estimate is admissible; it also satisfies the triangle
 * inequality, which makes it consistent.</p>
 */
@UtilityClass
public final class GreatCircleHeuristic {

    /**
     * Binds the heuristic to {@code goal} and returns a reusable estimator.
     */
    public static GoalBoundHeuristic bindGoal(ChargeStation goal) {
        Objects.requireNonNull(goal, "goal");
        double goalLat = goal.latitude();
        double goalLon = goal.longitude();
        return station -> GeoMath.greatCircleDistanceMeters(station.latitude(), station.longitude(), goalLat, goalLon);
    }

    /**
     * Zero estimate; turns A* into Dijkstra.
     */
    public static GoalBoundHeuristic none() {
        return station -> 0.0d;
    }
}

package org.chargenet.routing;

import org.chargenet.network.ChargeStation;

/**
 * Heuristic bound to one goal station.
 */
@FunctionalInterface
public interface GoalBoundHeuristic {
    /**
     * Returns a lower-bound estimate, in meters, of the road distance from
     * {@code station} to the bound goal.
     */
    double estimateFrom(ChargeStation station);
}

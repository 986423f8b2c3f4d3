package org.chargenet.oracle;

import org.chargenet.core.geo.Coordinate;

import java.util.List;

/**
 * External driving-directions service.
 *
 * <p>Implementations wrap a real directions API. The library only needs per-leg
 * road distance and duration, plus an overview polyline and bounds for trip output.</p>
 */
public interface RoutingOracle {

    /**
     * Requests driving directions through {@code waypoints} in order.
     *
     * @param waypoints at least two coordinates; the answer has {@code waypoints.size() - 1} legs.
     * @return directions for the whole route.
     * @throws RoutingOracleException when the service fails or returns no route.
     */
    Directions directions(List<Coordinate> waypoints);
}

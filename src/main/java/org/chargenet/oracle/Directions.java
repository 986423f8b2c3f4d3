package org.chargenet.oracle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Answer of a {@link RoutingOracle} request.
 */
@Value
@Builder
public class Directions {
    /** Legs in waypoint order. */
    @Singular
    List<DirectionsLeg> legs;
    /** Google encoded overview polyline, empty when the service returns none. */
    @Builder.Default
    String overviewPolyline = "";
    /** Route viewport, {@code null} when the service returns none. */
    BoundingBox bounds;
}

package org.chargenet.routing;

import lombok.Getter;
import org.chargenet.core.ChargeNetworkException;
import org.chargenet.network.ChargeStation;

/**
 * Thrown when the search frontier is exhausted before the goal is reached.
 */
@Getter
public final class PathNotFoundException extends ChargeNetworkException {
    public static final String REASON_CODE = "PATH_NOT_FOUND";

    private final int settledStations;

    public PathNotFoundException(ChargeStation start, ChargeStation goal, int settledStations) {
        super(REASON_CODE, "no path between the 2 charge stations was found: " + start + " -> " + goal
                + " (settled " + settledStations + ")");
        this.settledStations = settledStations;
    }
}

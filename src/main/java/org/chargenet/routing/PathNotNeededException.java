package org.chargenet.routing;

import org.chargenet.core.ChargeNetworkException;
import org.chargenet.network.ChargeStation;

/**
 * Thrown when a path is requested from a station to itself.
 */
public final class PathNotNeededException extends ChargeNetworkException {
    public static final String REASON_CODE = "PATH_NOT_NEEDED";

    public PathNotNeededException(ChargeStation station) {
        super(REASON_CODE, "tried to find a path between the same 2 charge stations: " + station);
    }
}

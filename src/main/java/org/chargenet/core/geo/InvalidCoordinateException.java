package org.chargenet.core.geo;

import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when a latitude/longitude pair falls outside the geodetic ranges.
 */
public final class InvalidCoordinateException extends ChargeNetworkException {
    public static final String REASON_CODE = "INVALID_COORDINATE";

    public InvalidCoordinateException(String message) {
        super(REASON_CODE, message);
    }
}

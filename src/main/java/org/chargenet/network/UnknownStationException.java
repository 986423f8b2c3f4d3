package org.chargenet.network;

import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when an operation references a station that is not a vertex of the network.
 */
public final class UnknownStationException extends ChargeNetworkException {
    public static final String REASON_CODE = "UNKNOWN_STATION";

    public UnknownStationException(ChargeStation station) {
        super(REASON_CODE, "charge station is not in the network: " + station);
    }
}

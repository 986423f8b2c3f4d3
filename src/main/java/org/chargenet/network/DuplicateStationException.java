package org.chargenet.network;

import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when a station that is already a vertex is added again.
 */
public final class DuplicateStationException extends ChargeNetworkException {
    public static final String REASON_CODE = "DUPLICATE_STATION";

    public DuplicateStationException(ChargeStation station) {
        super(REASON_CODE, "charge station is already in the network: " + station);
    }
}

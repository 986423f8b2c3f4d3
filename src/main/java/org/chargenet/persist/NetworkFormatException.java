package org.chargenet.persist;

import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when a network document is malformed or inconsistent.
 */
public final class NetworkFormatException extends ChargeNetworkException {
    public static final String REASON_CODE = "NETWORK_FORMAT";

    public NetworkFormatException(String message) {
        super(REASON_CODE, message);
    }

    public NetworkFormatException(String message, Throwable cause) {
        super(REASON_CODE, message, cause);
    }
}

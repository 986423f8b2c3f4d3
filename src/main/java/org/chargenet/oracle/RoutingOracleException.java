package org.chargenet.oracle;

import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when the routing oracle fails or returns an unusable answer.
 */
public final class RoutingOracleException extends ChargeNetworkException {
    public static final String REASON_CODE = "ORACLE_FAILURE";

    public RoutingOracleException(String message) {
        super(REASON_CODE, message);
    }

    public RoutingOracleException(String message, Throwable cause) {
        super(REASON_CODE, message, cause);
    }
}

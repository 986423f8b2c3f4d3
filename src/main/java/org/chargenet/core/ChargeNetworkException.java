package org.chargenet.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Base charge-network failure with a deterministic reason code.
 *
 * <p>Every concrete failure kind (duplicate vertex, missing path, oracle fault, ...)
 * is a subclass so callers can catch precisely, while the reason code keeps the
 * rendered message stable for logs and user-facing mapping.</p>
 */
@Getter
public class ChargeNetworkException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ChargeNetworkException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ChargeNetworkException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Returns the message without the reason-code prefix.
     */
    public String getDetail() {
        String message = getMessage();
        int close = message.indexOf("] ");
        return close < 0 ? message : message.substring(close + 2);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

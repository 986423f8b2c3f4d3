package org.chargenet.oracle;

import lombok.Getter;
import org.chargenet.core.ChargeNetworkException;

/**
 * Thrown when a {@link BatchConfirmation} gate declines a batch of oracle calls.
 */
@Getter
public final class BatchDeclinedException extends ChargeNetworkException {
    public static final String REASON_CODE = "BATCH_DECLINED";

    private final int callCount;

    public BatchDeclinedException(int callCount) {
        super(REASON_CODE, "batch of " + callCount + " routing oracle calls was declined");
        this.callCount = callCount;
    }
}

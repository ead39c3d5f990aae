package com.nosota.mloan.error;

/**
 * Operation would break the collateral ratio or a per-loan cap.
 */
public class InvariantViolationException extends LendingException {

    public InvariantViolationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvariantViolationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

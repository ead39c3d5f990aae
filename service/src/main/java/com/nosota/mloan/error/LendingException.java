package com.nosota.mloan.error;

import lombok.Getter;

/**
 * Base class of every business error raised by the collateral and loan engines.
 *
 * <p>Operations validate all preconditions before mutating state, so a thrown
 * {@code LendingException} always leaves the persisted state untouched: services roll
 * back their transaction on any subclass.
 */
@Getter
public abstract class LendingException extends Exception {

    private final ErrorCode errorCode;

    protected LendingException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected LendingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LendingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}

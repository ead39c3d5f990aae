package com.nosota.mloan.error;

/**
 * Caller identity is not permitted to perform the operation, or is not verified.
 */
public class UnauthorizedException extends LendingException {

    public UnauthorizedException(ErrorCode errorCode) {
        super(errorCode);
    }

    public UnauthorizedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

package com.nosota.mloan.error;

/**
 * Operation conflicts with the current status, lock flag or height window.
 */
public class InvalidStateException extends LendingException {

    public InvalidStateException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvalidStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

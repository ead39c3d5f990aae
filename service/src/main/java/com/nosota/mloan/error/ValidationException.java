package com.nosota.mloan.error;

/**
 * Bad amount, duration, currency, asset or configuration value.
 */
public class ValidationException extends LendingException {

    public ValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

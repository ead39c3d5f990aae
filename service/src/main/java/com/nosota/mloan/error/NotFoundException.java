package com.nosota.mloan.error;

/**
 * A loan, loan status record or collateral deposit does not exist.
 */
public class NotFoundException extends LendingException {

    public NotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }

    public NotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

package com.nosota.mloan.error;

/**
 * A collaborator (transfer service, lending pool, registry, repayment handler) failed.
 */
public class ExternalServiceException extends LendingException {

    public ExternalServiceException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ExternalServiceException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ExternalServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

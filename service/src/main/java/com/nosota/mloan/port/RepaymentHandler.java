package com.nosota.mloan.port;

import com.nosota.mloan.error.ExternalServiceException;

public interface RepaymentHandler {

    /**
     * Collects a repayment for a loan.
     *
     * @return true when the repayment was accepted
     */
    boolean processRepayment(long loanId, long amount) throws ExternalServiceException;
}

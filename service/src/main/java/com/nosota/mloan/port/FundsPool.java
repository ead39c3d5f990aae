package com.nosota.mloan.port;

import com.nosota.mloan.error.ExternalServiceException;

/**
 * Pooled lender funds: availability, interest quotes and disbursement.
 */
public interface FundsPool {

    long getAvailableFunds() throws ExternalServiceException;

    long calculateInterest(long principal, long durationBlocks) throws ExternalServiceException;

    /**
     * @return true when the principal was paid out to the recipient
     */
    boolean disburseFunds(long amount, String recipient) throws ExternalServiceException;
}

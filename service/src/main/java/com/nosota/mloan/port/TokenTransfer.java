package com.nosota.mloan.port;

import com.nosota.mloan.error.ExternalServiceException;

/**
 * Low-level value transfer between identities.
 */
public interface TokenTransfer {

    /**
     * Moves value from one identity to another.
     *
     * @return true when the transfer was executed, false when it was declined
     * @throws ExternalServiceException when the transfer service cannot be reached
     */
    boolean transfer(String currencyCode, long amount, String fromIdentity, String toIdentity)
            throws ExternalServiceException;
}

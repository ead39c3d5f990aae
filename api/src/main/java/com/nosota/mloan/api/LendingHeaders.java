package com.nosota.mloan.api;

/**
 * HTTP headers understood by the mLoan REST API.
 */
public final class LendingHeaders {

    /**
     * Identity of the party performing the call (borrower, voter, depositor or authority).
     */
    public static final String CALLER_IDENTITY = "X-Caller-Identity";

    private LendingHeaders() {
    }
}

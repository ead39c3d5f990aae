package com.nosota.mloan.port;

/**
 * Monotonically increasing height supplied by the execution environment.
 * Voting deadlines and loan maturity are expressed in heights.
 */
public interface ChainHeight {

    long current();
}

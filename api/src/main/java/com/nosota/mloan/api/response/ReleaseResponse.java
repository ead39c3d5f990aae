package com.nosota.mloan.api.response;

/**
 * Result of returning all collateral of a closed loan to its depositors.
 */
public record ReleaseResponse(
        Long loanId,
        Long totalReleased
) {}

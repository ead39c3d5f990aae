package com.nosota.mloan.api.response;

/**
 * Collateral engine view of a loan status.
 */
public record LoanStatusResponse(
        Long loanId,
        String status,
        Long referenceValue,
        Long lastUpdatedHeight
) {}

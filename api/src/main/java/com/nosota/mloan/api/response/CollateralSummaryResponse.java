package com.nosota.mloan.api.response;

/**
 * Aggregate over the live deposits of a loan.
 */
public record CollateralSummaryResponse(
        Long loanId,
        Long totalAmount,
        Long totalValue,
        Integer depositCount
) {}

package com.nosota.mloan.api.response;

/**
 * Result of closing the voting window of a loan.
 *
 * @param approved true when the loan was approved and disbursed
 * @param status   Loan status after finalization (ACTIVE or REJECTED)
 */
public record FinalizationResponse(
        Long loanId,
        Boolean approved,
        String status
) {}

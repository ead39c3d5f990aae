package com.nosota.mloan.api.response;

/**
 * Result of a collateral withdrawal.
 *
 * @param remainingAmount Amount left in the deposit (0 when the deposit was removed)
 */
public record WithdrawalResponse(
        Long loanId,
        Long collateralId,
        Long withdrawnAmount,
        Long remainingAmount
) {}

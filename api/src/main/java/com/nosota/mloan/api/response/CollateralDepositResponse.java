package com.nosota.mloan.api.response;

/**
 * A single live collateral deposit.
 */
public record CollateralDepositResponse(
        Long loanId,
        Long collateralId,
        Long amount,
        String currencyCode,
        Long depositedAtHeight,
        String depositorIdentity,
        Boolean locked
) {}

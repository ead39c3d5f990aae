package com.nosota.mloan.api.response;

/**
 * Result of a collateral liquidation.
 *
 * @param totalLiquidated Collateral amount moved to the pool recipient
 * @param penaltyValue    Liquidation penalty computed on the collateral value (reporting only)
 */
public record LiquidationResponse(
        Long loanId,
        Long totalLiquidated,
        Long penaltyValue
) {}

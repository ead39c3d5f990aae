package com.nosota.mloan.dto;

/**
 * Result of liquidating a defaulted loan's collateral.
 *
 * @param loanId          liquidated loan
 * @param totalLiquidated collateral amount moved to the pool recipient
 * @param penaltyValue    penalty computed on the collateral value; reported, not charged
 */
public record Liquidation(long loanId, long totalLiquidated, long penaltyValue) {
}

package com.nosota.mloan.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Request for a partial or full withdrawal of a single collateral deposit.
 *
 * @param amount Amount to withdraw; must not exceed the deposit amount
 */
public record WithdrawCollateralRequest(
        @NotNull(message = "Amount is required")
        Long amount
) {
}

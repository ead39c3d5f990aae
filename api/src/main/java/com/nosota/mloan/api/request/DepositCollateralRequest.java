package com.nosota.mloan.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request for depositing collateral against a loan.
 *
 * @param amount       Amount to deposit (in minor units of the currency)
 * @param currencyCode Collateral currency; must have an oracle binding
 */
public record DepositCollateralRequest(
        @NotNull(message = "Amount is required")
        Long amount,

        @NotBlank(message = "Currency code is required")
        String currencyCode
) {
}

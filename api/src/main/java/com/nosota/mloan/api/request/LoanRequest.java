package com.nosota.mloan.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request for a new loan. The borrower is the caller identity.
 *
 * @param amount           Principal to borrow
 * @param durationBlocks   Loan duration in blocks
 * @param assetReference   Reference to an asset known to the asset registry
 * @param collateralAmount Collateral posted with the request
 */
public record LoanRequest(
        @NotNull(message = "Amount is required")
        Long amount,

        @NotNull(message = "Duration is required")
        Long durationBlocks,

        @NotBlank(message = "Asset reference is required")
        String assetReference,

        @NotNull(message = "Collateral amount is required")
        Long collateralAmount
) {
}

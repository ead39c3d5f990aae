package com.nosota.mloan.api.request;

import com.nosota.mloan.api.model.LoanStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Authority request writing the collateral engine's view of a loan.
 *
 * @param status         Loan status
 * @param referenceValue Denominator of the collateral ratio (normally the principal)
 */
public record UpdateLoanStatusRequest(
        @NotNull(message = "Status is required")
        LoanStatus status,

        @NotNull(message = "Reference value is required")
        Long referenceValue
) {
}

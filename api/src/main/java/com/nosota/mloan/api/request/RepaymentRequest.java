package com.nosota.mloan.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * @param amount Repaid amount; must cover principal plus interest
 */
public record RepaymentRequest(
        @NotNull(message = "Amount is required")
        Long amount
) {
}

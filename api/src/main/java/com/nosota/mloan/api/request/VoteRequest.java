package com.nosota.mloan.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * @param approve true to vote for the loan, false to vote against it
 */
public record VoteRequest(
        @NotNull(message = "Vote is required")
        Boolean approve
) {
}

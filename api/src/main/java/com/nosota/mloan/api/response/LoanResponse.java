package com.nosota.mloan.api.response;

import java.time.LocalDateTime;

/**
 * Full loan record.
 */
public record LoanResponse(
        Long loanId,
        String borrowerIdentity,
        Long principalAmount,
        Long interestAmount,
        Long collateralAmount,
        String collateralCurrency,
        String assetReference,
        String status,
        Long startHeight,
        Long durationBlocks,
        Integer votesFor,
        Integer votesAgainst,
        Long votingDeadlineHeight,
        Long repaidAmount,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}

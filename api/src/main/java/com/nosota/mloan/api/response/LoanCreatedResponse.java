package com.nosota.mloan.api.response;

public record LoanCreatedResponse(
        Long loanId,
        String status,
        Long interestAmount,
        Long votingDeadlineHeight
) {}

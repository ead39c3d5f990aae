package com.nosota.mloan.api.response;

public record VoteResponse(
        Long loanId,
        String voterIdentity,
        Boolean approve,
        Integer votesFor,
        Integer votesAgainst
) {}

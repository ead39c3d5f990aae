package com.nosota.mloan.api.response;

public record ActiveLoanResponse(
        String borrowerIdentity,
        Boolean hasActiveLoan
) {}

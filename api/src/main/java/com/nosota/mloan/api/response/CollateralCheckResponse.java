package com.nosota.mloan.api.response;

public record CollateralCheckResponse(
        Long loanId,
        Boolean overCollateralized
) {}

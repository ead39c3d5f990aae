package com.nosota.mloan.api.response;

/**
 * Current loan lifecycle engine configuration.
 */
public record LoanSettingsResponse(
        String authority,
        String engineIdentity,
        Long maxLoanAmount,
        Long maxLoanDuration,
        Integer minCollateralRatio,
        Long votingPeriodBlocks,
        Integer approvalThresholdPercent,
        String collateralCurrency
) {}

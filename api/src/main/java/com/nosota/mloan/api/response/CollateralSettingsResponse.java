package com.nosota.mloan.api.response;

import java.util.Map;

/**
 * Current collateral engine configuration.
 */
public record CollateralSettingsResponse(
        String authority,
        Integer minCollateralRatio,
        Long maxCollateralPerLoan,
        Integer liquidationPenalty,
        Integer maxDepositsPerLoan,
        Map<String, String> currencyOracles
) {}

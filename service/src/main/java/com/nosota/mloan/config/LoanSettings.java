package com.nosota.mloan.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Configuration held by the loan lifecycle engine ({@code lending.loans.*}).
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanSettings {

    /**
     * Identity allowed to change these settings.
     */
    private volatile String authority;

    /**
     * Identity the engine uses when calling privileged collateral operations.
     * Must match {@link CollateralSettings#getAuthority()}.
     */
    private volatile String engineIdentity;

    private volatile long maxLoanAmount;

    private volatile long maxLoanDuration;

    /**
     * Minimum collateral in percent of the principal required at request time.
     */
    private volatile int minCollateralRatio;

    private volatile long votingPeriodBlocks;

    /**
     * Share of approving votes, in percent, needed to approve a loan.
     */
    private volatile int approvalThresholdPercent;

    /**
     * Currency of the collateral posted with a loan request.
     */
    private volatile String collateralCurrency;
}

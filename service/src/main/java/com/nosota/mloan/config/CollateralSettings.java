package com.nosota.mloan.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Configuration held by the collateral engine.
 *
 * <p>Initialised from {@code lending.collateral.*} properties and changed at runtime
 * by the authority through the engine's setters, which validate before writing.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CollateralSettings {

    /**
     * Maximum number of collateral IDs a loan can allocate.
     */
    public static final int MAX_DEPOSITS_PER_LOAN = 100;

    /**
     * Identity allowed to lock, unlock, update status, release, liquidate and reconfigure.
     * The loan lifecycle engine acts under this identity.
     */
    private volatile String authority;

    /**
     * Minimum collateral ratio in percent (150 = 1.5x the reference value).
     */
    private volatile int minCollateralRatio;

    /**
     * Maximum total collateral amount per loan.
     */
    private volatile long maxCollateralPerLoan;

    /**
     * Liquidation penalty in percent of the collateral value.
     */
    private volatile int liquidationPenalty;

    /**
     * Custody identity holding deposited value.
     */
    private volatile String vaultIdentity;

    /**
     * Recipient of liquidated collateral.
     */
    private volatile String poolRecipient;
}

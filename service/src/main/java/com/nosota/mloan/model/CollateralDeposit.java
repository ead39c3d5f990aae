package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single collateral deposit held in vault custody for a loan.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>Created by a deposit, with the next collateral ID of the loan</li>
 *   <li>Amount decreases on partial withdrawal</li>
 *   <li>Deleted when fully withdrawn, released or liquidated</li>
 * </ul>
 *
 * <p>The {@code locked} flag is a policy flag set by the authority. A locked deposit
 * cannot be withdrawn by its depositor, whatever the loan status.
 */
@Entity
@Table(name = "collateral_deposit")
@IdClass(CollateralDepositId.class)
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CollateralDeposit {

    @Id
    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    /**
     * Monotonic per loan, starting at 0. Never reused after the deposit is deleted.
     */
    @Id
    @Column(name = "collateral_id", nullable = false)
    private Long collateralId;

    /**
     * Deposited amount in minor units of {@link #currencyCode}.
     */
    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "currency_code", nullable = false, length = 16)
    private String currencyCode;

    @Column(name = "deposited_at_height", nullable = false)
    private Long depositedAtHeight;

    /**
     * Identity that transferred the value into custody. Only this identity can withdraw.
     */
    @Column(name = "depositor_identity", nullable = false)
    private String depositorIdentity;

    @Column(name = "locked", nullable = false)
    private boolean locked;
}

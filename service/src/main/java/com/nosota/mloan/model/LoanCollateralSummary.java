package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Aggregate over the live collateral deposits of a loan.
 *
 * <p>Always equal to the sum over {@link CollateralDeposit} rows of the loan; it is
 * updated in the same transaction as every deposit row change.
 */
@Entity
@Table(name = "loan_collateral_summary")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanCollateralSummary {

    @Id
    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount = 0L;

    /**
     * Sum of deposit values at the prices quoted when each deposit or withdrawal happened.
     */
    @Column(name = "total_value", nullable = false)
    private Long totalValue = 0L;

    @Column(name = "deposit_count", nullable = false)
    private Integer depositCount = 0;

    /**
     * Next collateral ID to allocate for this loan.
     */
    @Column(name = "next_collateral_id", nullable = false)
    private Long nextCollateralId = 0L;

    public static LoanCollateralSummary empty(Long loanId) {
        LoanCollateralSummary summary = new LoanCollateralSummary();
        summary.setLoanId(loanId);
        return summary;
    }
}

package com.nosota.mloan.model;

import com.nosota.mloan.api.model.LoanStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A loan request and its lifecycle.
 *
 * <p>Loan records are never deleted. Once the status reaches REPAID, REJECTED or
 * DEFAULTED the record is final.
 */
@Entity
@Table(name = "loan")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanRecord {

    /**
     * Allocated from {@link LoanSequence}, starting at 0.
     */
    @Id
    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Column(name = "borrower_identity", nullable = false)
    private String borrowerIdentity;

    @Column(name = "principal_amount", nullable = false)
    private Long principalAmount;

    /**
     * Interest quoted by the lending pool at request time.
     */
    @Column(name = "interest_amount", nullable = false)
    private Long interestAmount;

    @Column(name = "collateral_amount", nullable = false)
    private Long collateralAmount;

    @Column(name = "collateral_currency", nullable = false, length = 16)
    private String collateralCurrency;

    @Column(name = "asset_reference", nullable = false)
    private String assetReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LoanStatus status;

    /**
     * Height at which the loan was requested. Maturity is startHeight + durationBlocks.
     */
    @Column(name = "start_height", nullable = false)
    private Long startHeight;

    @Column(name = "duration_blocks", nullable = false)
    private Long durationBlocks;

    @Column(name = "votes_for", nullable = false)
    private Integer votesFor = 0;

    @Column(name = "votes_against", nullable = false)
    private Integer votesAgainst = 0;

    @Column(name = "voting_deadline_height", nullable = false)
    private Long votingDeadlineHeight;

    /**
     * Amount handed to the repayment handler. Null until the loan is repaid.
     */
    @Column(name = "repaid_amount")
    private Long repaidAmount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public long totalDue() {
        return principalAmount + interestAmount;
    }

    public long maturityHeight() {
        return startHeight + durationBlocks;
    }
}

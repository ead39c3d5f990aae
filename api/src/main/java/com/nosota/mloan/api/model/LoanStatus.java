package com.nosota.mloan.api.model;

/**
 * Loan status shared by the loan record and the collateral engine's status record.
 *
 * <pre>
 *        PENDING
 *        /     \
 *    ACTIVE   REJECTED
 *    /    \
 * REPAID  DEFAULTED
 * </pre>
 */
public enum LoanStatus {
    /**
     * PENDING: Loan has been requested and collateral deposited.
     * Voting is open until the voting deadline.
     */
    PENDING,

    /**
     * ACTIVE: Loan was approved and principal disbursed.
     * Collateral may be withdrawn down to the minimum ratio.
     */
    ACTIVE,

    /**
     * REPAID: Principal and interest were repaid and collateral released.
     * This is a final state.
     */
    REPAID,

    /**
     * REJECTED: Voting did not reach the approval threshold; collateral released.
     * This is a final state.
     */
    REJECTED,

    /**
     * DEFAULTED: Loan passed maturity while active; collateral liquidated.
     * This is a final state.
     */
    DEFAULTED;

    public boolean isTerminal() {
        return this == REPAID || this == REJECTED || this == DEFAULTED;
    }
}

package com.nosota.mloan.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Machine-readable reasons carried by every {@link LendingException}.
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {

    // Authorization
    NOT_AUTHORIZED("Caller is not authorized for this operation"),
    NOT_VERIFIED("Identity is not verified"),

    // Not found
    LOAN_NOT_FOUND("Loan not found"),
    LOAN_STATUS_NOT_FOUND("Loan status record not found"),
    COLLATERAL_NOT_FOUND("Collateral deposit not found"),

    // State
    INVALID_STATUS("Operation not allowed in the current loan status"),
    COLLATERAL_LOCKED("Collateral deposit is locked"),
    ACTIVE_LOAN_EXISTS("Borrower already has an active loan"),
    VOTING_CLOSED("Voting period has ended"),
    VOTING_OPEN("Voting period has not ended yet"),
    ALREADY_VOTED("Voter has already voted on this loan"),
    LOAN_NOT_MATURED("Loan has not reached maturity"),

    // Validation
    ZERO_AMOUNT("Amount must be positive"),
    INVALID_AMOUNT("Invalid amount"),
    INVALID_DURATION("Invalid duration"),
    INVALID_CURRENCY("Currency is not supported"),
    INVALID_ASSET("Asset has no registered owner"),
    INVALID_COLLATERAL("Collateral does not cover the minimum ratio"),
    INVALID_RATIO("Invalid collateral ratio"),
    INVALID_PENALTY("Invalid liquidation penalty"),
    INVALID_REFERENCE_VALUE("Reference value must be positive"),
    INVALID_IDENTITY("Identity must not be blank"),
    WITHDRAWAL_EXCEEDS("Withdrawal exceeds the deposited amount"),
    INSUFFICIENT_POOL_FUNDS("Lending pool has insufficient available funds"),
    AMOUNT_OVERFLOW("Amount is out of range"),

    // Invariant
    RATIO_BELOW_THRESHOLD("Collateral ratio would fall below the minimum"),
    MAX_COLLATERAL_EXCEEDED("Maximum number of collateral deposits reached for this loan"),
    MAX_COLLATERAL_AMOUNT_EXCEEDED("Maximum collateral amount exceeded for this loan"),
    INSUFFICIENT_COLLATERAL("Loan has no collateral to liquidate"),

    // External
    TRANSFER_FAILED("Value transfer failed"),
    DISBURSEMENT_FAILED("Lending pool disbursement failed"),
    REPAYMENT_FAILED("Repayment processing failed"),
    EXTERNAL_SERVICE_UNAVAILABLE("External service call failed");

    private final String defaultMessage;
}

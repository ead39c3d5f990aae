package com.nosota.mloan.api;

import com.nosota.mloan.api.request.LoanRequest;
import com.nosota.mloan.api.request.RepaymentRequest;
import com.nosota.mloan.api.request.VoteRequest;
import com.nosota.mloan.api.response.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Loan API of the mLoan service.
 *
 * <p>Defines REST endpoints of the loan lifecycle:
 * <ul>
 *   <li>Requesting a loan (collateral is deposited in the same operation)</li>
 *   <li>Voting on pending loans and finalizing the vote</li>
 *   <li>Repayment and default handling</li>
 *   <li>Engine configuration (authority only)</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>LoanController - in service module (server-side implementation)</li>
 *   <li>LoanClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/loans")
public interface LoanApi {

    /**
     * Requests a loan on behalf of the caller.
     *
     * @param caller  Borrower identity
     * @param request Principal, duration, asset reference and collateral
     * @return Created pending loan
     */
    @PostMapping
    ResponseEntity<LoanCreatedResponse> requestLoan(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestBody @Valid LoanRequest request) throws Exception;

    /**
     * Casts the caller's vote on a pending loan. One vote per voter and loan.
     */
    @PostMapping("/{loanId}/votes")
    ResponseEntity<VoteResponse> voteOnLoan(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @RequestBody @Valid VoteRequest request) throws Exception;

    /**
     * Closes voting after the deadline: approves and disburses, or rejects and releases collateral.
     */
    @PostMapping("/{loanId}/finalize")
    ResponseEntity<FinalizationResponse> finalizeLoan(
            @PathVariable("loanId") Long loanId) throws Exception;

    /**
     * Repays an active loan in full. Only the borrower can repay.
     */
    @PostMapping("/{loanId}/repay")
    ResponseEntity<LoanResponse> repayLoan(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @RequestBody @Valid RepaymentRequest request) throws Exception;

    /**
     * Marks an overdue active loan as defaulted and liquidates its collateral.
     */
    @PostMapping("/{loanId}/default")
    ResponseEntity<LiquidationResponse> markLoanDefault(
            @PathVariable("loanId") Long loanId) throws Exception;

    @GetMapping("/{loanId}")
    ResponseEntity<LoanResponse> getLoan(
            @PathVariable("loanId") Long loanId) throws Exception;

    @GetMapping("/borrowers/{borrower}/active")
    ResponseEntity<ActiveLoanResponse> hasActiveLoan(
            @PathVariable("borrower") String borrower);

    // ==================== Configuration ====================

    @GetMapping("/settings")
    ResponseEntity<LoanSettingsResponse> getSettings();

    @PutMapping("/settings/authority")
    ResponseEntity<LoanSettingsResponse> setAuthority(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotBlank String authority) throws Exception;

    /**
     * Changes the identity the engine presents to the collateral engine. Switching the collateral
     * authority takes two calls: {@code PUT /api/v1/collateral/settings/authority} first, then this one
     * with the same identity.
     */
    @PutMapping("/settings/engine-identity")
    ResponseEntity<LoanSettingsResponse> setEngineIdentity(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotBlank String engineIdentity) throws Exception;

    @PutMapping("/settings/max-amount")
    ResponseEntity<LoanSettingsResponse> setMaxLoanAmount(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Long amount) throws Exception;

    @PutMapping("/settings/max-duration")
    ResponseEntity<LoanSettingsResponse> setMaxLoanDuration(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Long duration) throws Exception;

    @PutMapping("/settings/min-ratio")
    ResponseEntity<LoanSettingsResponse> setMinCollateralRatio(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Integer ratio) throws Exception;
}

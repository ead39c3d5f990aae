package com.nosota.mloan.api;

import com.nosota.mloan.api.request.DepositCollateralRequest;
import com.nosota.mloan.api.request.UpdateLoanStatusRequest;
import com.nosota.mloan.api.request.WithdrawCollateralRequest;
import com.nosota.mloan.api.response.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Collateral API of the mLoan service.
 *
 * <p>Defines REST endpoints of the collateral accounting engine:
 * <ul>
 *   <li>Deposit and withdrawal of collateral (depositor operations)</li>
 *   <li>Lock/unlock, loan status updates, release and liquidation (authority operations)</li>
 *   <li>Read operations (deposits, per-loan summary, status, ratio check)</li>
 *   <li>Engine configuration (authority only)</li>
 * </ul>
 *
 * <p>Every mutating endpoint takes the caller identity from the
 * {@value LendingHeaders#CALLER_IDENTITY} header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>CollateralController - in service module (server-side implementation)</li>
 *   <li>CollateralClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/collateral")
public interface CollateralApi {

    // ==================== Depositor Operations ====================

    /**
     * Deposits collateral against a loan.
     *
     * @param caller  Depositor identity
     * @param loanId  Loan ID (must have a status record)
     * @param request Amount and currency
     * @return Created deposit
     */
    @PostMapping("/loans/{loanId}/deposits")
    ResponseEntity<CollateralDepositResponse> depositCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @RequestBody @Valid DepositCollateralRequest request) throws Exception;

    /**
     * Withdraws part or all of a deposit while the loan is active.
     *
     * @param caller       Depositor identity
     * @param loanId       Loan ID
     * @param collateralId Deposit ID within the loan
     * @param request      Amount to withdraw
     * @return Withdrawal result with the remaining deposit amount
     */
    @PostMapping("/loans/{loanId}/deposits/{collateralId}/withdraw")
    ResponseEntity<WithdrawalResponse> withdrawCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @PathVariable("collateralId") Long collateralId,
            @RequestBody @Valid WithdrawCollateralRequest request) throws Exception;

    // ==================== Authority Operations ====================

    @PostMapping("/loans/{loanId}/deposits/{collateralId}/lock")
    ResponseEntity<CollateralDepositResponse> lockCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @PathVariable("collateralId") Long collateralId) throws Exception;

    @PostMapping("/loans/{loanId}/deposits/{collateralId}/unlock")
    ResponseEntity<CollateralDepositResponse> unlockCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @PathVariable("collateralId") Long collateralId) throws Exception;

    /**
     * Writes the status record the collateral engine uses for ratio math and withdrawal checks.
     */
    @PutMapping("/loans/{loanId}/status")
    ResponseEntity<LoanStatusResponse> updateLoanStatus(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId,
            @RequestBody @Valid UpdateLoanStatusRequest request) throws Exception;

    /**
     * Returns every live deposit of a repaid or rejected loan to its depositor.
     */
    @PostMapping("/loans/{loanId}/release")
    ResponseEntity<ReleaseResponse> releaseCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId) throws Exception;

    /**
     * Moves all collateral of a defaulted loan to the pool recipient.
     * Succeeds at most once per loan.
     */
    @PostMapping("/loans/{loanId}/liquidate")
    ResponseEntity<LiquidationResponse> liquidateCollateral(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("loanId") Long loanId) throws Exception;

    // ==================== Query Operations ====================

    @GetMapping("/loans/{loanId}/deposits/{collateralId}")
    ResponseEntity<CollateralDepositResponse> getCollateral(
            @PathVariable("loanId") Long loanId,
            @PathVariable("collateralId") Long collateralId) throws Exception;

    @GetMapping("/loans/{loanId}/deposits")
    ResponseEntity<List<CollateralDepositResponse>> getLoanCollaterals(
            @PathVariable("loanId") Long loanId);

    @GetMapping("/loans/{loanId}/summary")
    ResponseEntity<CollateralSummaryResponse> getLoanCollateralSum(
            @PathVariable("loanId") Long loanId) throws Exception;

    @GetMapping("/loans/{loanId}/status")
    ResponseEntity<LoanStatusResponse> getLoanStatus(
            @PathVariable("loanId") Long loanId) throws Exception;

    /**
     * Checks the collateral ratio of a loan against the configured minimum.
     * Never fails: a loan without records is reported as not over-collateralized.
     */
    @GetMapping("/loans/{loanId}/over-collateralized")
    ResponseEntity<CollateralCheckResponse> isOverCollateralized(
            @PathVariable("loanId") Long loanId);

    // ==================== Configuration ====================

    @GetMapping("/settings")
    ResponseEntity<CollateralSettingsResponse> getSettings();

    @PutMapping("/settings/authority")
    ResponseEntity<CollateralSettingsResponse> setAuthority(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotBlank String authority) throws Exception;

    @PutMapping("/settings/min-ratio")
    ResponseEntity<CollateralSettingsResponse> setMinCollateralRatio(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Integer ratio) throws Exception;

    @PutMapping("/settings/max-per-loan")
    ResponseEntity<CollateralSettingsResponse> setMaxCollateralPerLoan(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Long max) throws Exception;

    @PutMapping("/settings/liquidation-penalty")
    ResponseEntity<CollateralSettingsResponse> setLiquidationPenalty(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @RequestParam("value") @NotNull Integer penalty) throws Exception;

    /**
     * Binds a currency to the oracle that prices it. Binding a currency makes it depositable.
     */
    @PutMapping("/oracles/{currencyCode}")
    ResponseEntity<CollateralSettingsResponse> setCurrencyOracle(
            @RequestHeader(LendingHeaders.CALLER_IDENTITY) @NotBlank String caller,
            @PathVariable("currencyCode") String currencyCode,
            @RequestParam("oracle") @NotBlank String oracleIdentity) throws Exception;
}

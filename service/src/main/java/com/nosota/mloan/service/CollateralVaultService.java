package com.nosota.mloan.service;

import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.config.CollateralSettings;
import com.nosota.mloan.dto.Liquidation;
import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ExternalServiceException;
import com.nosota.mloan.error.InvalidStateException;
import com.nosota.mloan.error.InvariantViolationException;
import com.nosota.mloan.error.LendingException;
import com.nosota.mloan.error.NotFoundException;
import com.nosota.mloan.error.UnauthorizedException;
import com.nosota.mloan.error.ValidationException;
import com.nosota.mloan.model.CollateralDeposit;
import com.nosota.mloan.model.CollateralDepositId;
import com.nosota.mloan.model.CurrencyOracleBinding;
import com.nosota.mloan.model.LoanCollateralSummary;
import com.nosota.mloan.model.LoanStatusRecord;
import com.nosota.mloan.port.ChainHeight;
import com.nosota.mloan.port.PriceOracle;
import com.nosota.mloan.port.TokenTransfer;
import com.nosota.mloan.repository.CollateralDepositRepository;
import com.nosota.mloan.repository.CurrencyOracleBindingRepository;
import com.nosota.mloan.repository.LoanCollateralSummaryRepository;
import com.nosota.mloan.repository.LoanStatusRecordRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collateral accounting engine.
 *
 * <p>Holds collateral deposits per loan in vault custody, keeps the per-loan summary
 * consistent with the deposits, enforces the minimum collateral ratio against the loan's
 * reference value and moves value through {@link TokenTransfer} on deposit, withdrawal,
 * release and liquidation.
 *
 * <p>Every mutating operation validates all of its preconditions before writing and runs
 * in one transaction; any {@link LendingException} rolls the whole operation back.
 * Rows are locked in the order status record, summary, deposit.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CollateralVaultService {

    private final CollateralDepositRepository depositRepository;
    private final LoanCollateralSummaryRepository summaryRepository;
    private final LoanStatusRecordRepository statusRepository;
    private final CurrencyOracleBindingRepository oracleBindingRepository;
    private final Map<String, PriceOracle> priceOracles;
    private final TokenTransfer tokenTransfer;
    private final ChainHeight chainHeight;
    private final CollateralSettings settings;

    /**
     * Deposits collateral for a loan on behalf of the caller.
     *
     * <p>The caller's value is moved into vault custody and a new deposit is created with
     * the next collateral ID of the loan. The deposit is rejected when it would leave the
     * loan below the minimum collateral ratio.
     *
     * @param caller       Depositor identity
     * @param loanId       Loan the collateral secures
     * @param amount       Amount to deposit, must be positive
     * @param currencyCode Currency of the deposit, must have an oracle binding
     * @return The collateral ID of the new deposit
     * @throws LendingException if any precondition fails or the transfer is declined
     */
    @Transactional(rollbackOn = LendingException.class)
    public long depositCollateral(@NotBlank String caller, @NotNull Long loanId, long amount,
                                  @NotBlank String currencyCode) throws LendingException {
        if (amount <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Deposit amount must be positive: " + amount);
        }

        CurrencyOracleBinding binding = oracleBindingRepository.findById(currencyCode)
                .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_CURRENCY,
                        "Currency is not supported: " + currencyCode));

        LoanStatusRecord statusRecord = statusRepository.findForUpdate(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_STATUS_NOT_FOUND,
                        "No status record for loan " + loanId));
        if (statusRecord.getStatus().isTerminal()) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Cannot deposit collateral for loan %d in status %s", loanId, statusRecord.getStatus()));
        }

        LoanCollateralSummary summary = summaryRepository.findForUpdate(loanId)
                .orElseGet(() -> LoanCollateralSummary.empty(loanId));

        if (summary.getNextCollateralId() >= CollateralSettings.MAX_DEPOSITS_PER_LOAN) {
            throw new InvariantViolationException(ErrorCode.MAX_COLLATERAL_EXCEEDED,
                    String.format("Loan %d already allocated %d collateral deposits", loanId, summary.getNextCollateralId()));
        }

        long newTotalAmount = CollateralMath.add(summary.getTotalAmount(), amount);
        if (newTotalAmount > settings.getMaxCollateralPerLoan()) {
            throw new InvariantViolationException(ErrorCode.MAX_COLLATERAL_AMOUNT_EXCEEDED,
                    String.format("Total collateral %d would exceed the maximum %d for loan %d",
                            newTotalAmount, settings.getMaxCollateralPerLoan(), loanId));
        }

        long depositValue = valueOf(binding, amount);
        long newTotalValue = CollateralMath.add(summary.getTotalValue(), depositValue);
        requireMinimumRatio(loanId, newTotalValue, statusRecord.getReferenceValue());

        transferOrThrow(currencyCode, amount, caller, settings.getVaultIdentity());

        long collateralId = summary.getNextCollateralId();
        CollateralDeposit deposit = new CollateralDeposit(
                loanId, collateralId, amount, currencyCode, chainHeight.current(), caller, false);
        depositRepository.save(deposit);

        summary.setTotalAmount(newTotalAmount);
        summary.setTotalValue(newTotalValue);
        summary.setDepositCount(summary.getDepositCount() + 1);
        summary.setNextCollateralId(collateralId + 1);
        summaryRepository.save(summary);

        log.info("Collateral {} deposited for loan {}: amount={} {}, value={}, depositor={}",
                collateralId, loanId, amount, currencyCode, depositValue, caller);
        return collateralId;
    }

    /**
     * Withdraws part or all of a deposit back to its depositor while the loan is active.
     * A withdrawal the oracle prices at 0 is rejected.
     *
     * @return The amount remaining in the deposit, 0 when the deposit was fully withdrawn and removed
     * @throws LendingException if any precondition fails or the transfer is declined
     */
    @Transactional(rollbackOn = LendingException.class)
    public long withdrawCollateral(@NotBlank String caller, @NotNull Long loanId, @NotNull Long collateralId,
                                   long amount) throws LendingException {
        if (amount <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Withdrawal amount must be positive: " + amount);
        }

        Optional<LoanStatusRecord> statusRecord = statusRepository.findForUpdate(loanId);
        Optional<LoanCollateralSummary> summary = summaryRepository.findForUpdate(loanId);
        CollateralDeposit deposit = findDepositForUpdate(loanId, collateralId);

        if (!deposit.getDepositorIdentity().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_AUTHORIZED,
                    String.format("Only the depositor can withdraw collateral %d of loan %d", collateralId, loanId));
        }
        if (deposit.isLocked()) {
            throw new InvalidStateException(ErrorCode.COLLATERAL_LOCKED,
                    String.format("Collateral %d of loan %d is locked", collateralId, loanId));
        }
        if (statusRecord.isEmpty() || statusRecord.get().getStatus() != LoanStatus.ACTIVE) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Collateral of loan %d can only be withdrawn while the loan is ACTIVE (status: %s)",
                            loanId, statusRecord.map(LoanStatusRecord::getStatus).orElse(null)));
        }
        if (amount > deposit.getAmount()) {
            throw new ValidationException(ErrorCode.WITHDRAWAL_EXCEEDS,
                    String.format("Withdrawal %d exceeds deposited amount %d", amount, deposit.getAmount()));
        }

        LoanCollateralSummary loanSummary = summary.orElseThrow(() -> new IllegalStateException(
                "Collateral summary missing for loan " + loanId + " with live deposit " + collateralId));

        CurrencyOracleBinding binding = oracleBindingRepository.findById(deposit.getCurrencyCode())
                .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_CURRENCY,
                        "Currency is no longer supported: " + deposit.getCurrencyCode()));
        long withdrawalValue = valueOf(binding, amount);
        if (withdrawalValue == 0) {
            throw new InvariantViolationException(ErrorCode.RATIO_BELOW_THRESHOLD,
                    String.format("No price quote for %d %s, collateral ratio of loan %d cannot be verified",
                            amount, deposit.getCurrencyCode(), loanId));
        }
        long newTotalAmount = loanSummary.getTotalAmount() - amount;
        // an empty vault carries no value, whatever the earlier quotes were
        long newTotalValue = newTotalAmount == 0 ? 0L : Math.max(0L, loanSummary.getTotalValue() - withdrawalValue);
        requireMinimumRatio(loanId, newTotalValue, statusRecord.get().getReferenceValue());

        transferOrThrow(deposit.getCurrencyCode(), amount, settings.getVaultIdentity(), caller);

        long remaining = deposit.getAmount() - amount;
        if (remaining == 0) {
            depositRepository.delete(deposit);
            loanSummary.setDepositCount(loanSummary.getDepositCount() - 1);
        } else {
            deposit.setAmount(remaining);
            depositRepository.save(deposit);
        }
        loanSummary.setTotalAmount(newTotalAmount);
        loanSummary.setTotalValue(newTotalValue);
        summaryRepository.save(loanSummary);

        log.info("Collateral {} of loan {} withdrawn: amount={}, remaining={}, depositor={}",
                collateralId, loanId, amount, remaining, caller);
        return remaining;
    }

    @Transactional(rollbackOn = LendingException.class)
    public void lockCollateral(@NotBlank String caller, @NotNull Long loanId, @NotNull Long collateralId)
            throws LendingException {
        setLocked(caller, loanId, collateralId, true);
    }

    @Transactional(rollbackOn = LendingException.class)
    public void unlockCollateral(@NotBlank String caller, @NotNull Long loanId, @NotNull Long collateralId)
            throws LendingException {
        setLocked(caller, loanId, collateralId, false);
    }

    /**
     * Creates or replaces the status record the collateral rules are evaluated against.
     *
     * @param referenceValue Value the collateral ratio is computed against, must be positive
     */
    @Transactional(rollbackOn = LendingException.class)
    public LoanStatusRecord updateLoanStatus(@NotBlank String caller, @NotNull Long loanId, @NotNull LoanStatus status,
                                             long referenceValue) throws LendingException {
        requireAuthority(caller);
        if (referenceValue <= 0) {
            throw new ValidationException(ErrorCode.INVALID_REFERENCE_VALUE,
                    "Reference value must be positive: " + referenceValue);
        }

        LoanStatusRecord statusRecord = statusRepository.findForUpdate(loanId)
                .orElseGet(() -> {
                    LoanStatusRecord created = new LoanStatusRecord();
                    created.setLoanId(loanId);
                    return created;
                });
        LoanStatus previous = statusRecord.getStatus();
        statusRecord.setStatus(status);
        statusRecord.setReferenceValue(referenceValue);
        statusRecord.setLastUpdatedHeight(chainHeight.current());
        statusRepository.save(statusRecord);

        log.info("Loan {} collateral status {} → {}, referenceValue={}", loanId, previous, status, referenceValue);
        return statusRecord;
    }

    /**
     * Returns every live deposit of a repaid or rejected loan to its depositor.
     *
     * <p>One transfer is made per depositor and currency. Deposits are deleted and the
     * summary is zeroed; the collateral ID counter is kept.
     *
     * @return Total amount released
     */
    @Transactional(rollbackOn = LendingException.class)
    public long releaseCollateral(@NotBlank String caller, @NotNull Long loanId) throws LendingException {
        requireAuthority(caller);

        LoanStatusRecord statusRecord = statusRepository.findForUpdate(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_STATUS_NOT_FOUND,
                        "No status record for loan " + loanId));
        if (statusRecord.getStatus() != LoanStatus.REPAID && statusRecord.getStatus() != LoanStatus.REJECTED) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Collateral of loan %d can only be released when REPAID or REJECTED (status: %s)",
                            loanId, statusRecord.getStatus()));
        }

        Optional<LoanCollateralSummary> summary = summaryRepository.findForUpdate(loanId);
        List<CollateralDeposit> deposits = depositRepository.findAllByLoanIdOrderByCollateralIdAsc(loanId);

        Map<String, Map<String, Long>> owedByDepositor = new LinkedHashMap<>();
        long totalReleased = 0L;
        for (CollateralDeposit deposit : deposits) {
            owedByDepositor
                    .computeIfAbsent(deposit.getDepositorIdentity(), depositor -> new TreeMap<>())
                    .merge(deposit.getCurrencyCode(), deposit.getAmount(), Long::sum);
            totalReleased += deposit.getAmount();
        }

        for (Map.Entry<String, Map<String, Long>> depositor : owedByDepositor.entrySet()) {
            for (Map.Entry<String, Long> owed : depositor.getValue().entrySet()) {
                transferOrThrow(owed.getKey(), owed.getValue(), settings.getVaultIdentity(), depositor.getKey());
            }
        }

        depositRepository.deleteAll(deposits);
        summary.ifPresent(this::zero);

        log.info("Released {} collateral deposits of loan {}: total={}", deposits.size(), loanId, totalReleased);
        return totalReleased;
    }

    /**
     * Seizes all collateral of a defaulted loan for the pool recipient.
     *
     * <p>The status record and all deposits of the loan are removed, so a second
     * liquidation of the same loan fails with {@link ErrorCode#LOAN_STATUS_NOT_FOUND}.
     */
    @Transactional(rollbackOn = LendingException.class)
    public Liquidation liquidateCollateral(@NotBlank String caller, @NotNull Long loanId) throws LendingException {
        requireAuthority(caller);

        LoanStatusRecord statusRecord = statusRepository.findForUpdate(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_STATUS_NOT_FOUND,
                        "No status record for loan " + loanId));
        if (statusRecord.getStatus() != LoanStatus.DEFAULTED) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Collateral of loan %d can only be liquidated when DEFAULTED (status: %s)",
                            loanId, statusRecord.getStatus()));
        }

        LoanCollateralSummary summary = summaryRepository.findForUpdate(loanId)
                .filter(s -> s.getTotalAmount() > 0)
                .orElseThrow(() -> new InvariantViolationException(ErrorCode.INSUFFICIENT_COLLATERAL,
                        "Loan " + loanId + " has no collateral to liquidate"));

        List<CollateralDeposit> deposits = depositRepository.findAllByLoanIdOrderByCollateralIdAsc(loanId);
        Map<String, Long> amountByCurrency = new TreeMap<>();
        for (CollateralDeposit deposit : deposits) {
            amountByCurrency.merge(deposit.getCurrencyCode(), deposit.getAmount(), Long::sum);
        }
        for (Map.Entry<String, Long> seized : amountByCurrency.entrySet()) {
            transferOrThrow(seized.getKey(), seized.getValue(), settings.getVaultIdentity(), settings.getPoolRecipient());
        }

        long totalLiquidated = summary.getTotalAmount();
        long penaltyValue = CollateralMath.percentOf(summary.getTotalValue(), settings.getLiquidationPenalty());

        zero(summary);
        statusRepository.delete(statusRecord);
        depositRepository.deleteAll(deposits);

        log.info("Liquidated collateral of loan {}: total={}, penaltyValue={}, recipient={}",
                loanId, totalLiquidated, penaltyValue, settings.getPoolRecipient());
        return new Liquidation(loanId, totalLiquidated, penaltyValue);
    }

    /**
     * Checks whether a loan's collateral meets the minimum ratio against its reference value.
     *
     * @return false when the loan has no summary or no status record
     */
    public boolean isOverCollateralized(@NotNull Long loanId) {
        Optional<LoanCollateralSummary> summary = summaryRepository.findById(loanId);
        Optional<LoanStatusRecord> statusRecord = statusRepository.findById(loanId);
        if (summary.isEmpty() || statusRecord.isEmpty()) {
            return false;
        }
        long ratio = CollateralMath.ratio(summary.get().getTotalValue(), statusRecord.get().getReferenceValue());
        return ratio >= settings.getMinCollateralRatio();
    }

    public CollateralDeposit getCollateral(@NotNull Long loanId, @NotNull Long collateralId) throws NotFoundException {
        return depositRepository.findById(new CollateralDepositId(loanId, collateralId))
                .orElseThrow(() -> new NotFoundException(ErrorCode.COLLATERAL_NOT_FOUND,
                        String.format("Collateral %d of loan %d not found", collateralId, loanId)));
    }

    public List<CollateralDeposit> getLoanCollaterals(@NotNull Long loanId) {
        return depositRepository.findAllByLoanIdOrderByCollateralIdAsc(loanId);
    }

    /**
     * @return The loan's summary, or an all-zero summary when nothing was ever deposited
     */
    public LoanCollateralSummary getLoanCollateralSum(@NotNull Long loanId) {
        return summaryRepository.findById(loanId).orElseGet(() -> LoanCollateralSummary.empty(loanId));
    }

    public LoanStatusRecord getLoanStatus(@NotNull Long loanId) throws NotFoundException {
        return statusRepository.findById(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_STATUS_NOT_FOUND,
                        "No status record for loan " + loanId));
    }

    public CollateralSettings getSettings() {
        return settings;
    }

    /**
     * @return Currency code to oracle identity, ordered by currency
     */
    public Map<String, String> getCurrencyOracles() {
        Map<String, String> oracles = new TreeMap<>();
        oracleBindingRepository.findAll()
                .forEach(binding -> oracles.put(binding.getCurrencyCode(), binding.getOracleIdentity()));
        return oracles;
    }

    // ==================== Administration ====================

    /**
     * Changes the authority. The loan engine calls under {@code LoanSettings.engineIdentity}, so it
     * is locked out until {@link LoanManagerService#setEngineIdentity} is given the same identity.
     */
    public void setAuthority(@NotBlank String caller, String newAuthority) throws LendingException {
        requireAuthority(caller);
        if (!StringUtils.hasText(newAuthority)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Authority must not be blank");
        }
        settings.setAuthority(newAuthority);
        log.info("Collateral authority changed from {} to {}", caller, newAuthority);
    }

    public void setMinCollateralRatio(@NotBlank String caller, int minCollateralRatio) throws LendingException {
        requireAuthority(caller);
        if (minCollateralRatio < 100 || minCollateralRatio > 300) {
            throw new ValidationException(ErrorCode.INVALID_RATIO,
                    "Minimum collateral ratio must be between 100 and 300: " + minCollateralRatio);
        }
        settings.setMinCollateralRatio(minCollateralRatio);
        log.info("Minimum collateral ratio set to {}", minCollateralRatio);
    }

    public void setMaxCollateralPerLoan(@NotBlank String caller, long maxCollateralPerLoan) throws LendingException {
        requireAuthority(caller);
        if (maxCollateralPerLoan <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    "Maximum collateral per loan must be positive: " + maxCollateralPerLoan);
        }
        settings.setMaxCollateralPerLoan(maxCollateralPerLoan);
        log.info("Maximum collateral per loan set to {}", maxCollateralPerLoan);
    }

    public void setLiquidationPenalty(@NotBlank String caller, int liquidationPenalty) throws LendingException {
        requireAuthority(caller);
        if (liquidationPenalty < 0 || liquidationPenalty > 10) {
            throw new ValidationException(ErrorCode.INVALID_PENALTY,
                    "Liquidation penalty must be between 0 and 10: " + liquidationPenalty);
        }
        settings.setLiquidationPenalty(liquidationPenalty);
        log.info("Liquidation penalty set to {}", liquidationPenalty);
    }

    /**
     * Binds a currency to the price oracle bean with the given identity, making the currency
     * acceptable as collateral. An identity with no matching oracle prices the currency at 0.
     */
    @Transactional(rollbackOn = LendingException.class)
    public void setCurrencyOracle(@NotBlank String caller, String currencyCode, String oracleIdentity)
            throws LendingException {
        requireAuthority(caller);
        if (!StringUtils.hasText(currencyCode)) {
            throw new ValidationException(ErrorCode.INVALID_CURRENCY, "Currency code must not be blank");
        }
        if (!StringUtils.hasText(oracleIdentity)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Oracle identity must not be blank");
        }
        if (!priceOracles.containsKey(oracleIdentity)) {
            log.warn("Currency {} bound to unknown oracle {}, deposits will be valued at 0", currencyCode, oracleIdentity);
        }
        oracleBindingRepository.save(new CurrencyOracleBinding(currencyCode, oracleIdentity));
        log.info("Currency {} bound to oracle {}", currencyCode, oracleIdentity);
    }

    // ==================== Internals ====================

    private void setLocked(String caller, Long loanId, Long collateralId, boolean locked) throws LendingException {
        requireAuthority(caller);
        CollateralDeposit deposit = findDepositForUpdate(loanId, collateralId);
        deposit.setLocked(locked);
        depositRepository.save(deposit);
        log.info("Collateral {} of loan {} {}", collateralId, loanId, locked ? "locked" : "unlocked");
    }

    private CollateralDeposit findDepositForUpdate(Long loanId, Long collateralId) throws NotFoundException {
        return depositRepository.findForUpdate(loanId, collateralId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.COLLATERAL_NOT_FOUND,
                        String.format("Collateral %d of loan %d not found", collateralId, loanId)));
    }

    private void requireAuthority(String caller) throws UnauthorizedException {
        if (!settings.getAuthority().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_AUTHORIZED,
                    "Caller " + caller + " is not the collateral authority");
        }
    }

    private void requireMinimumRatio(Long loanId, long totalValue, long referenceValue) throws InvariantViolationException {
        long ratio = CollateralMath.ratio(totalValue, referenceValue);
        if (ratio < settings.getMinCollateralRatio()) {
            throw new InvariantViolationException(ErrorCode.RATIO_BELOW_THRESHOLD,
                    String.format("Collateral ratio %d%% of loan %d would be below the minimum %d%%",
                            ratio, loanId, settings.getMinCollateralRatio()));
        }
    }

    private long valueOf(CurrencyOracleBinding binding, long amount) throws ExternalServiceException, ValidationException {
        PriceOracle oracle = priceOracles.get(binding.getOracleIdentity());
        if (oracle == null) {
            log.warn("No price oracle {} for currency {}, valuing at 0", binding.getOracleIdentity(), binding.getCurrencyCode());
            return 0L;
        }
        long unitPrice = oracle.getPrice(binding.getCurrencyCode(), amount);
        return CollateralMath.value(amount, unitPrice);
    }

    private void transferOrThrow(String currencyCode, long amount, String from, String to) throws ExternalServiceException {
        if (!tokenTransfer.transfer(currencyCode, amount, from, to)) {
            throw new ExternalServiceException(ErrorCode.TRANSFER_FAILED,
                    String.format("Transfer of %d %s from %s to %s was declined", amount, currencyCode, from, to));
        }
    }

    private void zero(LoanCollateralSummary summary) {
        summary.setTotalAmount(0L);
        summary.setTotalValue(0L);
        summary.setDepositCount(0);
        summaryRepository.save(summary);
    }
}

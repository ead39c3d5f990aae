package com.nosota.mloan.service;

import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.config.LoanSettings;
import com.nosota.mloan.dto.Liquidation;
import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ExternalServiceException;
import com.nosota.mloan.error.InvalidStateException;
import com.nosota.mloan.error.LendingException;
import com.nosota.mloan.error.NotFoundException;
import com.nosota.mloan.error.UnauthorizedException;
import com.nosota.mloan.error.ValidationException;
import com.nosota.mloan.model.LoanRecord;
import com.nosota.mloan.model.LoanSequence;
import com.nosota.mloan.model.LoanVote;
import com.nosota.mloan.model.LoanVoteId;
import com.nosota.mloan.port.ChainHeight;
import com.nosota.mloan.port.FundsPool;
import com.nosota.mloan.port.Registry;
import com.nosota.mloan.port.RepaymentHandler;
import com.nosota.mloan.repository.LoanRecordRepository;
import com.nosota.mloan.repository.LoanSequenceRepository;
import com.nosota.mloan.repository.LoanVoteRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Loan lifecycle engine.
 *
 * <p>Loan lifecycle:
 * <ol>
 *   <li>requestLoan: borrower posts collateral, loan is PENDING and open for votes</li>
 *   <li>voteOnLoan: verified voters approve or reject until the voting deadline</li>
 *   <li>finalizeLoan: after the deadline, ACTIVE with the principal disbursed, or REJECTED with collateral released</li>
 *   <li>repayLoan: borrower repays principal and interest, loan is REPAID and collateral released</li>
 *   <li>markLoanDefault: after maturity an unpaid loan is DEFAULTED and its collateral liquidated</li>
 * </ol>
 *
 * <p>The engine keeps the collateral engine's status record in step with the loan status,
 * calling it under {@link LoanSettings#getEngineIdentity()}. Collateral calls join the
 * engine's transaction, so a failure anywhere rolls back loan and collateral state together.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class LoanManagerService {

    private final LoanRecordRepository loanRepository;
    private final LoanVoteRepository voteRepository;
    private final LoanSequenceRepository sequenceRepository;
    private final CollateralVaultService collateralVaultService;
    private final LoanStatusStateMachine stateMachine;
    private final FundsPool fundsPool;
    private final Registry registry;
    private final RepaymentHandler repaymentHandler;
    private final ChainHeight chainHeight;
    private final LoanSettings settings;

    /**
     * Requests a loan secured by collateral deposited from the borrower.
     *
     * <p>Creates the collateral status record (PENDING, reference value = principal),
     * deposits the collateral on behalf of the borrower and opens the loan for voting
     * until {@code height + votingPeriodBlocks}.
     *
     * @param borrower         Borrower identity, must be verified
     * @param amount           Principal, 1..maxLoanAmount
     * @param durationBlocks   Duration in blocks, 1..maxLoanDuration
     * @param assetReference   Asset reference that must have a registered owner
     * @param collateralAmount Collateral in the configured collateral currency
     * @return The new loan ID
     * @throws LendingException if any precondition or collaborator call fails
     */
    @Transactional(rollbackOn = LendingException.class)
    public long requestLoan(@NotBlank String borrower, long amount, long durationBlocks,
                            @NotBlank String assetReference, long collateralAmount) throws LendingException {
        if (!registry.isVerified(borrower)) {
            throw new UnauthorizedException(ErrorCode.NOT_VERIFIED, "Borrower " + borrower + " is not verified");
        }

        // Serializes loan creation, which makes the active-loan check below race free.
        LoanSequence sequence = lockSequence();

        if (loanRepository.existsByBorrowerIdentityAndStatus(borrower, LoanStatus.ACTIVE)) {
            throw new InvalidStateException(ErrorCode.ACTIVE_LOAN_EXISTS,
                    "Borrower " + borrower + " already has an active loan");
        }
        if (amount < 1 || amount > settings.getMaxLoanAmount()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    String.format("Loan amount must be between 1 and %d: %d", settings.getMaxLoanAmount(), amount));
        }
        if (durationBlocks < 1 || durationBlocks > settings.getMaxLoanDuration()) {
            throw new ValidationException(ErrorCode.INVALID_DURATION,
                    String.format("Loan duration must be between 1 and %d blocks: %d",
                            settings.getMaxLoanDuration(), durationBlocks));
        }
        if (registry.getAssetOwner(assetReference).isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_ASSET,
                    "Asset " + assetReference + " has no registered owner");
        }
        long requiredCollateral = CollateralMath.percentOf(amount, settings.getMinCollateralRatio());
        if (collateralAmount < requiredCollateral) {
            throw new ValidationException(ErrorCode.INVALID_COLLATERAL,
                    String.format("Collateral %d is below the required %d", collateralAmount, requiredCollateral));
        }
        long availableFunds = fundsPool.getAvailableFunds();
        if (availableFunds < amount) {
            throw new ValidationException(ErrorCode.INSUFFICIENT_POOL_FUNDS,
                    String.format("Lending pool has %d available, %d requested", availableFunds, amount));
        }

        long interest = fundsPool.calculateInterest(amount, durationBlocks);
        long loanId = sequence.getNextLoanId();
        long height = chainHeight.current();

        collateralVaultService.updateLoanStatus(settings.getEngineIdentity(), loanId, LoanStatus.PENDING, amount);
        collateralVaultService.depositCollateral(borrower, loanId, collateralAmount, settings.getCollateralCurrency());

        LocalDateTime now = LocalDateTime.now();
        LoanRecord loan = new LoanRecord();
        loan.setLoanId(loanId);
        loan.setBorrowerIdentity(borrower);
        loan.setPrincipalAmount(amount);
        loan.setInterestAmount(interest);
        loan.setCollateralAmount(collateralAmount);
        loan.setCollateralCurrency(settings.getCollateralCurrency());
        loan.setAssetReference(assetReference);
        loan.setStatus(LoanStatus.PENDING);
        loan.setStartHeight(height);
        loan.setDurationBlocks(durationBlocks);
        loan.setVotesFor(0);
        loan.setVotesAgainst(0);
        loan.setVotingDeadlineHeight(height + settings.getVotingPeriodBlocks());
        loan.setCreatedAt(now);
        loan.setUpdatedAt(now);
        loanRepository.save(loan);

        sequence.setNextLoanId(loanId + 1);
        sequenceRepository.save(sequence);

        log.info("Loan {} requested by {}: principal={}, interest={}, duration={}, collateral={} {}, votingDeadline={}",
                loanId, borrower, amount, interest, durationBlocks, collateralAmount,
                settings.getCollateralCurrency(), loan.getVotingDeadlineHeight());
        return loanId;
    }

    /**
     * Records a vote on a pending loan. Each voter votes at most once per loan.
     *
     * @return The loan with updated tallies
     */
    @Transactional(rollbackOn = LendingException.class)
    public LoanRecord voteOnLoan(@NotBlank String voter, @NotNull Long loanId, boolean approve) throws LendingException {
        LoanRecord loan = findLoanForUpdate(loanId);

        if (!registry.isVerified(voter)) {
            throw new UnauthorizedException(ErrorCode.NOT_VERIFIED, "Voter " + voter + " is not verified");
        }
        requireStatus(loan, LoanStatus.PENDING);
        long height = chainHeight.current();
        if (height > loan.getVotingDeadlineHeight()) {
            throw new InvalidStateException(ErrorCode.VOTING_CLOSED,
                    String.format("Voting on loan %d closed at height %d", loanId, loan.getVotingDeadlineHeight()));
        }
        if (voteRepository.existsByLoanIdAndVoterIdentity(loanId, voter)) {
            throw new InvalidStateException(ErrorCode.ALREADY_VOTED,
                    String.format("%s has already voted on loan %d", voter, loanId));
        }

        voteRepository.save(new LoanVote(loanId, voter, approve, height));
        if (approve) {
            loan.setVotesFor(loan.getVotesFor() + 1);
        } else {
            loan.setVotesAgainst(loan.getVotesAgainst() + 1);
        }
        loan.setUpdatedAt(LocalDateTime.now());
        loanRepository.save(loan);

        log.info("Vote on loan {} by {}: approve={}, for={}, against={}",
                loanId, voter, approve, loan.getVotesFor(), loan.getVotesAgainst());
        return loan;
    }

    /**
     * Closes voting on a loan once its deadline has passed.
     *
     * <p>The loan is approved when at least one vote was cast and the approving share
     * reaches the approval threshold. An approved loan becomes ACTIVE and the principal is
     * disbursed to the borrower; a rejected loan becomes REJECTED and its collateral is released.
     *
     * @return true when the loan was approved
     */
    @Transactional(rollbackOn = LendingException.class)
    public boolean finalizeLoan(@NotNull Long loanId) throws LendingException {
        LoanRecord loan = findLoanForUpdate(loanId);

        if (chainHeight.current() <= loan.getVotingDeadlineHeight()) {
            throw new InvalidStateException(ErrorCode.VOTING_OPEN,
                    String.format("Voting on loan %d is open until height %d", loanId, loan.getVotingDeadlineHeight()));
        }
        requireStatus(loan, LoanStatus.PENDING);

        int totalVotes = loan.getVotesFor() + loan.getVotesAgainst();
        boolean approved = totalVotes > 0
                && loan.getVotesFor() * 100L / totalVotes >= settings.getApprovalThresholdPercent();

        if (approved) {
            transition(loan, LoanStatus.ACTIVE);
            collateralVaultService.updateLoanStatus(
                    settings.getEngineIdentity(), loanId, LoanStatus.ACTIVE, loan.getPrincipalAmount());
            loanRepository.saveAndFlush(loan);

            // Last step: a disbursement cannot be undone by a rollback.
            if (!fundsPool.disburseFunds(loan.getPrincipalAmount(), loan.getBorrowerIdentity())) {
                throw new ExternalServiceException(ErrorCode.DISBURSEMENT_FAILED,
                        String.format("Lending pool declined to disburse %d to %s for loan %d",
                                loan.getPrincipalAmount(), loan.getBorrowerIdentity(), loanId));
            }
        } else {
            transition(loan, LoanStatus.REJECTED);
            collateralVaultService.updateLoanStatus(
                    settings.getEngineIdentity(), loanId, LoanStatus.REJECTED, loan.getPrincipalAmount());
            collateralVaultService.releaseCollateral(settings.getEngineIdentity(), loanId);
            loanRepository.save(loan);
        }

        log.info("Loan {} finalized: approved={}, for={}, against={}",
                loanId, approved, loan.getVotesFor(), loan.getVotesAgainst());
        return approved;
    }

    /**
     * Repays an active loan in full and returns its collateral.
     *
     * @param amount Amount handed to the repayment handler, at least principal + interest.
     *               Any excess is recorded as part of the repaid amount and not refunded.
     */
    @Transactional(rollbackOn = LendingException.class)
    public LoanRecord repayLoan(@NotBlank String caller, @NotNull Long loanId, long amount) throws LendingException {
        LoanRecord loan = findLoanForUpdate(loanId);

        if (!loan.getBorrowerIdentity().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_AUTHORIZED,
                    String.format("Only the borrower can repay loan %d", loanId));
        }
        requireStatus(loan, LoanStatus.ACTIVE);
        if (amount < loan.totalDue()) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    String.format("Repayment %d is below the amount due %d", amount, loan.totalDue()));
        }
        if (!repaymentHandler.processRepayment(loanId, amount)) {
            throw new ExternalServiceException(ErrorCode.REPAYMENT_FAILED,
                    String.format("Repayment of %d for loan %d was not accepted", amount, loanId));
        }

        transition(loan, LoanStatus.REPAID);
        loan.setRepaidAmount(amount);
        collateralVaultService.updateLoanStatus(
                settings.getEngineIdentity(), loanId, LoanStatus.REPAID, loan.getPrincipalAmount());
        long released = collateralVaultService.releaseCollateral(settings.getEngineIdentity(), loanId);
        loanRepository.save(loan);

        log.info("Loan {} repaid by {}: amount={}, collateralReleased={}", loanId, caller, amount, released);
        return loan;
    }

    /**
     * Marks a matured, unpaid loan as defaulted and liquidates its collateral.
     */
    @Transactional(rollbackOn = LendingException.class)
    public Liquidation markLoanDefault(@NotNull Long loanId) throws LendingException {
        LoanRecord loan = findLoanForUpdate(loanId);

        if (chainHeight.current() <= loan.maturityHeight()) {
            throw new InvalidStateException(ErrorCode.LOAN_NOT_MATURED,
                    String.format("Loan %d matures at height %d", loanId, loan.maturityHeight()));
        }
        requireStatus(loan, LoanStatus.ACTIVE);

        transition(loan, LoanStatus.DEFAULTED);
        loanRepository.save(loan);
        collateralVaultService.updateLoanStatus(
                settings.getEngineIdentity(), loanId, LoanStatus.DEFAULTED, loan.getPrincipalAmount());
        Liquidation liquidation = collateralVaultService.liquidateCollateral(settings.getEngineIdentity(), loanId);

        log.warn("Loan {} of {} defaulted: liquidated={}, penaltyValue={}",
                loanId, loan.getBorrowerIdentity(), liquidation.totalLiquidated(), liquidation.penaltyValue());
        return liquidation;
    }

    public LoanRecord getLoan(@NotNull Long loanId) throws NotFoundException {
        return loanRepository.findById(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_NOT_FOUND, "Loan " + loanId + " not found"));
    }

    public boolean hasActiveLoan(@NotBlank String borrower) {
        return loanRepository.existsByBorrowerIdentityAndStatus(borrower, LoanStatus.ACTIVE);
    }

    public Optional<LoanVote> getVote(@NotNull Long loanId, @NotBlank String voter) {
        return voteRepository.findById(new LoanVoteId(loanId, voter));
    }

    public LoanSettings getSettings() {
        return settings;
    }

    // ==================== Administration ====================

    public void setAuthority(@NotBlank String caller, String newAuthority) throws LendingException {
        requireAuthority(caller);
        if (!StringUtils.hasText(newAuthority)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Authority must not be blank");
        }
        settings.setAuthority(newAuthority);
        log.info("Loan authority changed from {} to {}", caller, newAuthority);
    }

    /**
     * Changes the identity used for privileged collateral calls. It must equal the collateral
     * engine's authority, so a new collateral authority is followed by this call.
     */
    public void setEngineIdentity(@NotBlank String caller, String newEngineIdentity) throws LendingException {
        requireAuthority(caller);
        if (!StringUtils.hasText(newEngineIdentity)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTITY, "Engine identity must not be blank");
        }
        String previous = settings.getEngineIdentity();
        settings.setEngineIdentity(newEngineIdentity);
        log.info("Loan engine identity changed from {} to {}", previous, newEngineIdentity);
    }

    public void setMaxLoanAmount(@NotBlank String caller, long maxLoanAmount) throws LendingException {
        requireAuthority(caller);
        if (maxLoanAmount <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Maximum loan amount must be positive: " + maxLoanAmount);
        }
        settings.setMaxLoanAmount(maxLoanAmount);
        log.info("Maximum loan amount set to {}", maxLoanAmount);
    }

    public void setMaxLoanDuration(@NotBlank String caller, long maxLoanDuration) throws LendingException {
        requireAuthority(caller);
        if (maxLoanDuration <= 0) {
            throw new ValidationException(ErrorCode.INVALID_DURATION,
                    "Maximum loan duration must be positive: " + maxLoanDuration);
        }
        settings.setMaxLoanDuration(maxLoanDuration);
        log.info("Maximum loan duration set to {}", maxLoanDuration);
    }

    public void setMinCollateralRatio(@NotBlank String caller, int minCollateralRatio) throws LendingException {
        requireAuthority(caller);
        if (minCollateralRatio <= 100) {
            throw new ValidationException(ErrorCode.INVALID_RATIO,
                    "Minimum collateral ratio must be above 100: " + minCollateralRatio);
        }
        settings.setMinCollateralRatio(minCollateralRatio);
        log.info("Loan minimum collateral ratio set to {}", minCollateralRatio);
    }

    // ==================== Internals ====================

    private LoanSequence lockSequence() {
        return sequenceRepository.findForUpdate(LoanSequence.SINGLETON_ID)
                .orElseGet(() -> sequenceRepository.saveAndFlush(new LoanSequence(LoanSequence.SINGLETON_ID, 0L)));
    }

    private LoanRecord findLoanForUpdate(Long loanId) throws NotFoundException {
        return loanRepository.findForUpdate(loanId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.LOAN_NOT_FOUND, "Loan " + loanId + " not found"));
    }

    private void requireStatus(LoanRecord loan, LoanStatus expected) throws InvalidStateException {
        if (loan.getStatus() != expected) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Loan %d is %s, expected %s", loan.getLoanId(), loan.getStatus(), expected));
        }
    }

    private void transition(LoanRecord loan, LoanStatus target) throws InvalidStateException {
        stateMachine.validateTransition(loan.getStatus(), target);
        loan.setStatus(target);
        loan.setUpdatedAt(LocalDateTime.now());
    }

    private void requireAuthority(String caller) throws UnauthorizedException {
        if (!settings.getAuthority().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_AUTHORIZED, "Caller " + caller + " is not the loan authority");
        }
    }
}

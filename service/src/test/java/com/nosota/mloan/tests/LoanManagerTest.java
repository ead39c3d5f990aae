package com.nosota.mloan.tests;

import com.nosota.mloan.TestBase;
import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.dto.Liquidation;
import com.nosota.mloan.error.*;
import com.nosota.mloan.model.LoanRecord;
import com.nosota.mloan.model.LoanSequence;
import com.nosota.mloan.model.TokenTransferEntry;
import com.nosota.mloan.support.StubFundsPool;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the loan lifecycle engine and its coordination with the collateral engine.
 */
public class LoanManagerTest extends TestBase {

    @Test
    void requestLoanCreatesPendingLoanWithCollateral() throws Exception {
        chainHeight.set(5L);

        long loanId = requestStandardLoan(BORROWER);

        assertThat(loanId).isZero();
        LoanRecord loan = loanManagerService.getLoan(loanId);
        assertThat(loan.getStatus()).isEqualTo(LoanStatus.PENDING);
        assertThat(loan.getPrincipalAmount()).isEqualTo(1000L);
        assertThat(loan.getInterestAmount()).isEqualTo(20L);
        assertThat(loan.getStartHeight()).isEqualTo(5L);
        assertThat(loan.getVotingDeadlineHeight()).isEqualTo(105L);
        assertThat(loan.getVotesFor()).isZero();
        assertThat(loan.getVotesAgainst()).isZero();
        assertThat(loan.getCollateralCurrency()).isEqualTo("A");

        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.PENDING);
        assertThat(collateralVaultService.getLoanStatus(loanId).getReferenceValue()).isEqualTo(1000L);
        assertThat(collateralVaultService.getCollateral(loanId, 0L).getDepositorIdentity()).isEqualTo(BORROWER);
        assertThat(collateralVaultService.getLoanCollateralSum(loanId).getTotalAmount()).isEqualTo(1500L);

        assertThat(requestStandardLoan("borrower-2")).isEqualTo(1L);
    }

    @Test
    void rejectedRequestLeavesNoTraceAndKeepsNextLoanId() throws Exception {
        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 20_000L, 30L, ASSET, 30_000L))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AMOUNT);

        assertThat(loanRepository.count()).isZero();
        assertThat(statusRepository.count()).isZero();
        assertThat(sequenceRepository.findById(LoanSequence.SINGLETON_ID)
                .map(LoanSequence::getNextLoanId).orElse(0L)).isZero();

        assertThat(requestStandardLoan(BORROWER)).isZero();
    }

    @Test
    void requestLoanChecksPreconditionsInOrder() throws Exception {
        registry.unverify("stranger");
        assertThatThrownBy(() -> loanManagerService.requestLoan("stranger", 1000L, 30L, ASSET, 1500L))
                .isInstanceOf(UnauthorizedException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_VERIFIED);

        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 0L, 30L, ASSET, 1500L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AMOUNT);
        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 1000L, 0L, ASSET, 1500L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_DURATION);
        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 1000L, 91L, ASSET, 1500L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_DURATION);

        registry.removeOwner("orphan-asset");
        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 1000L, 30L, "orphan-asset", 1500L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_ASSET);

        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 1000L, 30L, ASSET, 1499L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_COLLATERAL);

        fundsPool.setAvailableFunds(999L);
        assertThatThrownBy(() -> loanManagerService.requestLoan(BORROWER, 1000L, 30L, ASSET, 1500L))
                .extracting("errorCode").isEqualTo(ErrorCode.INSUFFICIENT_POOL_FUNDS);

        assertThat(loanRepository.count()).isZero();
    }

    @Test
    void borrowerWithActiveLoanCannotRequestAnother() throws Exception {
        activeLoan(BORROWER);

        assertThatThrownBy(() -> requestStandardLoan(BORROWER))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ACTIVE_LOAN_EXISTS);
        assertThat(loanManagerService.hasActiveLoan(BORROWER)).isTrue();
        assertThat(loanManagerService.hasActiveLoan("borrower-2")).isFalse();
    }

    @Test
    void failedCollateralTransferRollsBackLoanRequest() {
        tokenTransfer.declineAll();

        assertThatThrownBy(() -> requestStandardLoan(BORROWER))
                .isInstanceOf(ExternalServiceException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TRANSFER_FAILED);

        assertThat(loanRepository.count()).isZero();
        assertThat(statusRepository.count()).isZero();
        assertThat(summaryRepository.count()).isZero();
    }

    @Test
    void votingRecordsOneVotePerVoter() throws Exception {
        long loanId = requestStandardLoan(BORROWER);

        LoanRecord afterFirst = loanManagerService.voteOnLoan("voter-1", loanId, true);
        assertThat(afterFirst.getVotesFor()).isEqualTo(1);

        assertThatThrownBy(() -> loanManagerService.voteOnLoan("voter-1", loanId, false))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ALREADY_VOTED);

        LoanRecord afterBorrower = loanManagerService.voteOnLoan(BORROWER, loanId, false);
        assertThat(afterBorrower.getVotesFor()).isEqualTo(1);
        assertThat(afterBorrower.getVotesAgainst()).isEqualTo(1);

        assertThat(voteRepository.findAllByLoanId(loanId)).hasSize(2);
        assertThat(loanManagerService.getVote(loanId, "voter-1")).hasValueSatisfying(vote -> assertThat(vote.isApprove()).isTrue());
    }

    @Test
    void votingChecksVoterStatusAndDeadline() throws Exception {
        assertThatThrownBy(() -> loanManagerService.voteOnLoan("voter-1", 42L, true))
                .isInstanceOf(NotFoundException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.LOAN_NOT_FOUND);

        long loanId = requestStandardLoan(BORROWER);

        registry.unverify("stranger");
        assertThatThrownBy(() -> loanManagerService.voteOnLoan("stranger", loanId, true))
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_VERIFIED);

        chainHeight.set(100L);
        loanManagerService.voteOnLoan("voter-1", loanId, true);

        chainHeight.set(101L);
        assertThatThrownBy(() -> loanManagerService.voteOnLoan("voter-2", loanId, true))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.VOTING_CLOSED);
        assertThat(loanManagerService.getLoan(loanId).getVotesFor()).isEqualTo(1);
    }

    @Test
    void finalizeWithUnanimousApprovalActivatesAndDisbursesOnce() throws Exception {
        long loanId = requestStandardLoan(BORROWER);
        loanManagerService.voteOnLoan("voter-1", loanId, true);

        chainHeight.set(100L);
        assertThatThrownBy(() -> loanManagerService.finalizeLoan(loanId))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.VOTING_OPEN);

        chainHeight.set(101L);
        assertThat(loanManagerService.finalizeLoan(loanId)).isTrue();

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(fundsPool.getDisbursements()).containsExactly(new StubFundsPool.Disbursement(1000L, BORROWER));

        assertThatThrownBy(() -> loanManagerService.finalizeLoan(loanId))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThat(fundsPool.getDisbursements()).hasSize(1);
    }

    @Test
    void finalizeWithoutVotesRejectsAndReleasesCollateral() throws Exception {
        long loanId = requestStandardLoan(BORROWER);
        chainHeight.set(101L);

        assertThat(loanManagerService.finalizeLoan(loanId)).isFalse();

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.REJECTED);
        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.REJECTED);
        assertThat(collateralVaultService.getLoanCollaterals(loanId)).isEmpty();
        assertThat(collateralVaultService.getLoanCollateralSum(loanId).getTotalAmount()).isZero();
        assertThat(tokenTransferRepository.findAllByToIdentityOrderByIdAsc(BORROWER))
                .extracting(TokenTransferEntry::getAmount).containsExactly(1500L);
        assertThat(fundsPool.getDisbursements()).isEmpty();
    }

    @Test
    void approvalNeedsThresholdShareOfVotes() throws Exception {
        long approvedLoan = requestStandardLoan(BORROWER);
        long rejectedLoan = requestStandardLoan("borrower-2");
        for (int i = 1; i <= 3; i++) {
            loanManagerService.voteOnLoan("voter-" + i, approvedLoan, true);
        }
        loanManagerService.voteOnLoan("voter-4", approvedLoan, false);
        loanManagerService.voteOnLoan("voter-1", rejectedLoan, true);
        loanManagerService.voteOnLoan("voter-2", rejectedLoan, true);
        loanManagerService.voteOnLoan("voter-3", rejectedLoan, false);

        chainHeight.set(101L);

        assertThat(loanManagerService.finalizeLoan(approvedLoan)).isTrue();
        assertThat(loanManagerService.finalizeLoan(rejectedLoan)).isFalse();
    }

    @Test
    void failedDisbursementKeepsLoanPending() throws Exception {
        long loanId = requestStandardLoan(BORROWER);
        loanManagerService.voteOnLoan("voter-1", loanId, true);
        chainHeight.set(101L);
        fundsPool.setDeclineDisbursements(true);

        assertThatThrownBy(() -> loanManagerService.finalizeLoan(loanId))
                .isInstanceOf(ExternalServiceException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.DISBURSEMENT_FAILED);

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.PENDING);
        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.PENDING);
    }

    @Test
    void repaymentReleasesCollateralToBorrower() throws Exception {
        long loanId = activeLoan(BORROWER);

        assertThatThrownBy(() -> loanManagerService.repayLoan("borrower-2", loanId, 1020L))
                .isInstanceOf(UnauthorizedException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_AUTHORIZED);
        assertThatThrownBy(() -> loanManagerService.repayLoan(BORROWER, loanId, 1019L))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AMOUNT);

        LoanRecord repaid = loanManagerService.repayLoan(BORROWER, loanId, 1100L);

        assertThat(repaid.getStatus()).isEqualTo(LoanStatus.REPAID);
        assertThat(repaid.getRepaidAmount()).isEqualTo(1100L);
        assertThat(repaymentHandler.getRepayments()).containsEntry(loanId, 1100L);
        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.REPAID);
        assertThat(collateralVaultService.getLoanCollaterals(loanId)).isEmpty();
        assertThat(tokenTransferRepository.findAllByToIdentityOrderByIdAsc(BORROWER))
                .extracting(TokenTransferEntry::getAmount).containsExactly(1500L);
        assertThat(loanManagerService.hasActiveLoan(BORROWER)).isFalse();
    }

    @Test
    void declinedRepaymentLeavesLoanActive() throws Exception {
        long loanId = activeLoan(BORROWER);
        repaymentHandler.setDeclineRepayments(true);

        assertThatThrownBy(() -> loanManagerService.repayLoan(BORROWER, loanId, 1020L))
                .isInstanceOf(ExternalServiceException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.REPAYMENT_FAILED);

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(collateralVaultService.getLoanCollateralSum(loanId).getTotalAmount()).isEqualTo(1500L);
    }

    @Test
    void repaymentRequiresActiveLoan() throws Exception {
        long loanId = requestStandardLoan(BORROWER);

        assertThatThrownBy(() -> loanManagerService.repayLoan(BORROWER, loanId, 1020L))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThat(repaymentHandler.getRepayments()).isEmpty();
    }

    @Test
    void defaultLiquidatesCollateralExactlyOnce() throws Exception {
        long loanId = activeLoan(BORROWER);

        Liquidation liquidation = loanManagerService.markLoanDefault(loanId);

        assertThat(liquidation.totalLiquidated()).isEqualTo(1500L);
        assertThat(liquidation.penaltyValue()).isEqualTo(75L);
        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.DEFAULTED);
        assertThat(collateralVaultService.getLoanCollaterals(loanId)).isEmpty();
        assertThat(statusRepository.findById(loanId)).isEmpty();
        assertThat(tokenTransferRepository.findAllByToIdentityOrderByIdAsc(POOL))
                .extracting(TokenTransferEntry::getAmount).containsExactly(1500L);

        assertThatThrownBy(() -> loanManagerService.markLoanDefault(loanId))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThat(tokenTransferRepository.findAllByToIdentityOrderByIdAsc(POOL)).hasSize(1);
    }

    @Test
    void defaultWaitsForMaturity() throws Exception {
        loanSettings.setVotingPeriodBlocks(10L);
        long loanId = activeLoan(BORROWER);
        assertThat(chainHeight.current()).isEqualTo(11L);

        chainHeight.set(30L);
        assertThatThrownBy(() -> loanManagerService.markLoanDefault(loanId))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.LOAN_NOT_MATURED);

        chainHeight.set(31L);
        assertThat(loanManagerService.markLoanDefault(loanId).totalLiquidated()).isEqualTo(1500L);
    }

    @Test
    void terminalLoansNeverChangeStatus() throws Exception {
        long loanId = activeLoan(BORROWER);
        loanManagerService.repayLoan(BORROWER, loanId, 1020L);

        assertThatThrownBy(() -> loanManagerService.finalizeLoan(loanId))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThatThrownBy(() -> loanManagerService.voteOnLoan("late-voter", loanId, true))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThatThrownBy(() -> loanManagerService.markLoanDefault(loanId))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);
        assertThatThrownBy(() -> loanManagerService.repayLoan(BORROWER, loanId, 1020L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATUS);

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.REPAID);
    }

    @Test
    void administrationIsRestrictedToAuthority() throws Exception {
        assertThatThrownBy(() -> loanManagerService.setMaxLoanAmount(BORROWER, 20_000L))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> loanManagerService.setMinCollateralRatio(ADMIN, 100))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_RATIO);
        assertThatThrownBy(() -> loanManagerService.setMaxLoanDuration(ADMIN, 0L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_DURATION);
        assertThatThrownBy(() -> loanManagerService.setMaxLoanAmount(ADMIN, 0L))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AMOUNT);

        loanManagerService.setMaxLoanAmount(ADMIN, 20_000L);
        loanManagerService.setMinCollateralRatio(ADMIN, 101);

        assertThat(requestStandardLoan(BORROWER)).isZero();
        long bigLoan = loanManagerService.requestLoan("borrower-2", 20_000L, 30L, ASSET, 30_000L);
        assertThat(loanManagerService.getLoan(bigLoan).getPrincipalAmount()).isEqualTo(20_000L);

        loanManagerService.setAuthority(ADMIN, "new-admin");
        assertThatThrownBy(() -> loanManagerService.setMaxLoanAmount(ADMIN, 1L))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void engineFollowsCollateralAuthorityChange() throws Exception {
        collateralVaultService.setAuthority(ENGINE, "ops");

        assertThatThrownBy(() -> requestStandardLoan(BORROWER))
                .isInstanceOf(UnauthorizedException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_AUTHORIZED);
        assertThat(loanRepository.count()).isZero();

        assertThatThrownBy(() -> loanManagerService.setEngineIdentity(BORROWER, "ops"))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> loanManagerService.setEngineIdentity(ADMIN, " "))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_IDENTITY);

        loanManagerService.setEngineIdentity(ADMIN, "ops");
        long loanId = activeLoan(BORROWER);

        assertThat(loanManagerService.getLoan(loanId).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(collateralVaultService.getLoanStatus(loanId).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(loanManagerService.repayLoan(BORROWER, loanId, 1020L).getStatus()).isEqualTo(LoanStatus.REPAID);
    }
}

package com.nosota.mloan.tests;

import com.nosota.mloan.TestBase;
import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.service.LoanMaintenanceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the sweeps run by the loan lifecycle scheduler.
 */
public class LoanMaintenanceTest extends TestBase {

    @Autowired
    private LoanMaintenanceService loanMaintenanceService;

    @Test
    void finalizesOnlyLoansPastTheirDeadline() throws Exception {
        long early = requestStandardLoan(BORROWER);
        loanManagerService.voteOnLoan("voter-1", early, true);
        chainHeight.set(50L);
        long late = requestStandardLoan("borrower-2");

        chainHeight.set(101L);
        assertThat(loanMaintenanceService.finalizeClosedVotes()).isEqualTo(1);

        assertThat(loanManagerService.getLoan(early).getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(loanManagerService.getLoan(late).getStatus()).isEqualTo(LoanStatus.PENDING);

        chainHeight.set(151L);
        assertThat(loanMaintenanceService.finalizeClosedVotes()).isEqualTo(1);
        assertThat(loanManagerService.getLoan(late).getStatus()).isEqualTo(LoanStatus.REJECTED);
        assertThat(loanMaintenanceService.finalizeClosedVotes()).isZero();
    }

    @Test
    void failingLoanDoesNotStopTheSweep() throws Exception {
        long first = requestStandardLoan(BORROWER);
        long second = requestStandardLoan("borrower-2");
        loanManagerService.voteOnLoan("voter-1", first, true);
        loanManagerService.voteOnLoan("voter-1", second, true);
        chainHeight.set(101L);
        fundsPool.setDeclineDisbursements(true);

        assertThat(loanMaintenanceService.finalizeClosedVotes()).isZero();

        fundsPool.setDeclineDisbursements(false);
        assertThat(loanMaintenanceService.finalizeClosedVotes()).isEqualTo(2);
        assertThat(fundsPool.getDisbursements()).hasSize(2);
    }

    @Test
    void defaultsActiveLoansPastMaturity() throws Exception {
        long overdue = activeLoan(BORROWER);
        long repaid = activeLoan("borrower-2");
        loanManagerService.repayLoan("borrower-2", repaid, 1020L);

        assertThat(loanMaintenanceService.defaultMaturedLoans()).isEqualTo(1);

        assertThat(loanManagerService.getLoan(overdue).getStatus()).isEqualTo(LoanStatus.DEFAULTED);
        assertThat(loanManagerService.getLoan(repaid).getStatus()).isEqualTo(LoanStatus.REPAID);
        assertThat(loanMaintenanceService.defaultMaturedLoans()).isZero();
    }
}

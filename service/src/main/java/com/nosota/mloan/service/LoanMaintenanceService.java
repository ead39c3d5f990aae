package com.nosota.mloan.service;

import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.error.LendingException;
import com.nosota.mloan.port.ChainHeight;
import com.nosota.mloan.repository.LoanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sweeps loans whose lifecycle can advance without a user action.
 *
 * <p>Each loan is processed in its own transaction through {@link LoanManagerService};
 * a loan that fails is logged and left for the next sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanMaintenanceService {

    private final LoanRecordRepository loanRepository;
    private final LoanManagerService loanManagerService;
    private final ChainHeight chainHeight;

    /**
     * Finalizes pending loans whose voting deadline has passed.
     *
     * @return Number of loans finalized
     */
    public int finalizeClosedVotes() {
        long height = chainHeight.current();
        List<Long> loanIds = loanRepository.findLoanIdsWithVotingDeadlineBefore(LoanStatus.PENDING, height);

        int finalized = 0;
        for (Long loanId : loanIds) {
            try {
                boolean approved = loanManagerService.finalizeLoan(loanId);
                log.debug("Finalized loan {} at height {}: approved={}", loanId, height, approved);
                finalized++;
            } catch (LendingException e) {
                log.error("Failed to finalize loan {} [code={}]: {}", loanId, e.getErrorCode(), e.getMessage());
            }
        }
        return finalized;
    }

    /**
     * Marks active loans past maturity as defaulted and liquidates their collateral.
     *
     * @return Number of loans defaulted
     */
    public int defaultMaturedLoans() {
        long height = chainHeight.current();
        List<Long> loanIds = loanRepository.findLoanIdsMaturedBefore(LoanStatus.ACTIVE, height);

        int defaulted = 0;
        for (Long loanId : loanIds) {
            try {
                loanManagerService.markLoanDefault(loanId);
                defaulted++;
            } catch (LendingException e) {
                log.error("Failed to default loan {} [code={}]: {}", loanId, e.getErrorCode(), e.getMessage());
            }
        }
        return defaulted;
    }
}

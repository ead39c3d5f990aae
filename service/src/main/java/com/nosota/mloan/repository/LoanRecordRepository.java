package com.nosota.mloan.repository;

import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.model.LoanRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LoanRecordRepository extends JpaRepository<LoanRecord, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LoanRecord l WHERE l.loanId = :loanId")
    Optional<LoanRecord> findForUpdate(@Param("loanId") Long loanId);

    /**
     * Checks whether a borrower has a loan in the given status.
     * There is no borrower index: this scans the loan table.
     */
    boolean existsByBorrowerIdentityAndStatus(String borrowerIdentity, LoanStatus status);

    /**
     * Finds loans in the given status whose voting deadline is before the given height.
     */
    @Query("SELECT l.loanId FROM LoanRecord l " +
           "WHERE l.status = :status " +
           "AND l.votingDeadlineHeight < :height " +
           "ORDER BY l.loanId ASC")
    List<Long> findLoanIdsWithVotingDeadlineBefore(@Param("status") LoanStatus status,
                                                   @Param("height") Long height);

    /**
     * Finds loans in the given status whose maturity (start + duration) is before the given height.
     */
    @Query("SELECT l.loanId FROM LoanRecord l " +
           "WHERE l.status = :status " +
           "AND l.startHeight + l.durationBlocks < :height " +
           "ORDER BY l.loanId ASC")
    List<Long> findLoanIdsMaturedBefore(@Param("status") LoanStatus status,
                                        @Param("height") Long height);
}

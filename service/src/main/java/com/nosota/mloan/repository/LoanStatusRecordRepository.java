package com.nosota.mloan.repository;

import com.nosota.mloan.model.LoanStatusRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LoanStatusRecordRepository extends JpaRepository<LoanStatusRecord, Long> {

    /**
     * Retrieves the status record of a loan and locks it for update.
     * Every value-changing collateral operation on the loan takes this lock first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM LoanStatusRecord r WHERE r.loanId = :loanId")
    Optional<LoanStatusRecord> findForUpdate(@Param("loanId") Long loanId);
}

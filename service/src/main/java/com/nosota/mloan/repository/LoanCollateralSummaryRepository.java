package com.nosota.mloan.repository;

import com.nosota.mloan.model.LoanCollateralSummary;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LoanCollateralSummaryRepository extends JpaRepository<LoanCollateralSummary, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LoanCollateralSummary s WHERE s.loanId = :loanId")
    Optional<LoanCollateralSummary> findForUpdate(@Param("loanId") Long loanId);
}

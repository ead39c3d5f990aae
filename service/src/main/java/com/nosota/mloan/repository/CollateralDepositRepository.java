package com.nosota.mloan.repository;

import com.nosota.mloan.model.CollateralDeposit;
import com.nosota.mloan.model.CollateralDepositId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CollateralDepositRepository extends JpaRepository<CollateralDeposit, CollateralDepositId> {

    /**
     * Retrieves a deposit and locks it for update.
     *
     * @param loanId       Loan ID
     * @param collateralId Deposit ID within the loan
     * @return The deposit, if it exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM CollateralDeposit d WHERE d.loanId = :loanId AND d.collateralId = :collateralId")
    Optional<CollateralDeposit> findForUpdate(@Param("loanId") Long loanId,
                                              @Param("collateralId") Long collateralId);

    List<CollateralDeposit> findAllByLoanIdOrderByCollateralIdAsc(Long loanId);

    @Query("SELECT COALESCE(SUM(d.amount), 0) FROM CollateralDeposit d WHERE d.loanId = :loanId")
    Long sumAmountByLoanId(@Param("loanId") Long loanId);
}

package com.nosota.mloan.repository;

import com.nosota.mloan.model.LoanSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LoanSequenceRepository extends JpaRepository<LoanSequence, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LoanSequence s WHERE s.id = :id")
    Optional<LoanSequence> findForUpdate(@Param("id") Integer id);
}

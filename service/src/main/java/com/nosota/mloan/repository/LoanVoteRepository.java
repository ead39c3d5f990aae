package com.nosota.mloan.repository;

import com.nosota.mloan.model.LoanVote;
import com.nosota.mloan.model.LoanVoteId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LoanVoteRepository extends JpaRepository<LoanVote, LoanVoteId> {

    boolean existsByLoanIdAndVoterIdentity(Long loanId, String voterIdentity);

    List<LoanVote> findAllByLoanId(Long loanId);
}

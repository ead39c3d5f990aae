package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A voter's decision on a pending loan. The primary key (loanId, voterIdentity)
 * allows one vote per pair; votes are never updated.
 */
@Entity
@Table(name = "loan_vote")
@IdClass(LoanVoteId.class)
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanVote {

    @Id
    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Id
    @Column(name = "voter_identity", nullable = false)
    private String voterIdentity;

    @Column(name = "approve", nullable = false)
    private boolean approve;

    @Column(name = "cast_at_height", nullable = false)
    private Long castAtHeight;
}

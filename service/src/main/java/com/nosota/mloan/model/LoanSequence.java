package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single-row counter of loan IDs.
 *
 * <p>Read with a pessimistic lock and advanced in the transaction that creates the
 * loan, so a failed request leaves the next ID unchanged and loan creation is serialized.
 */
@Entity
@Table(name = "loan_sequence")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanSequence {

    public static final Integer SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false)
    private Integer id;

    @Column(name = "next_loan_id", nullable = false)
    private Long nextLoanId;
}

package com.nosota.mloan.model;

import com.nosota.mloan.api.model.LoanStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Collateral engine view of a loan: its status and the reference value used as the
 * denominator of the collateral ratio. Written by the authority only.
 */
@Entity
@Table(name = "loan_status_record")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanStatusRecord {

    @Id
    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LoanStatus status;

    @Column(name = "reference_value", nullable = false)
    private Long referenceValue;

    @Column(name = "last_updated_height", nullable = false)
    private Long lastUpdatedHeight;
}

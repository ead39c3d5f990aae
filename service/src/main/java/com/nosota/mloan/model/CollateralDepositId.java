package com.nosota.mloan.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

/**
 * Composite key of {@link CollateralDeposit}: (loanId, collateralId).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class CollateralDepositId implements Serializable {
    private Long loanId;
    private Long collateralId;
}

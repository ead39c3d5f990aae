package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Binds a collateral currency to the oracle that prices it.
 * A currency without a binding cannot be deposited.
 */
@Entity
@Table(name = "currency_oracle_binding")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CurrencyOracleBinding {

    @Id
    @Column(name = "currency_code", nullable = false, length = 16)
    private String currencyCode;

    /**
     * Bean name of the {@link com.nosota.mloan.port.PriceOracle} implementation.
     */
    @Column(name = "oracle_identity", nullable = false)
    private String oracleIdentity;
}

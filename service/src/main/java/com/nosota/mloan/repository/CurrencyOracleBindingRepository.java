package com.nosota.mloan.repository;

import com.nosota.mloan.model.CurrencyOracleBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CurrencyOracleBindingRepository extends JpaRepository<CurrencyOracleBinding, String> {
}

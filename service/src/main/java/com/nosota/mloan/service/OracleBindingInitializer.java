package com.nosota.mloan.service;

import com.nosota.mloan.config.OracleProperties;
import com.nosota.mloan.model.CurrencyOracleBinding;
import com.nosota.mloan.repository.CurrencyOracleBindingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds currency to oracle bindings from {@code lending.oracle.bindings} when none are stored yet.
 * Bindings changed at runtime by the authority are kept across restarts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleBindingInitializer implements ApplicationRunner {

    private final CurrencyOracleBindingRepository bindingRepository;
    private final OracleProperties oracleProperties;

    @Override
    public void run(ApplicationArguments args) {
        if (bindingRepository.count() > 0) {
            log.debug("Currency oracle bindings already present, skipping seeding");
            return;
        }

        oracleProperties.getBindings().forEach((currencyCode, oracleIdentity) -> {
            bindingRepository.save(new CurrencyOracleBinding(currencyCode, oracleIdentity));
            log.info("Bound currency {} to oracle {}", currencyCode, oracleIdentity);
        });
    }
}

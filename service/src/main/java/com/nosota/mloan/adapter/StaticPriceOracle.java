package com.nosota.mloan.adapter;

import com.nosota.mloan.config.OracleProperties;
import com.nosota.mloan.port.PriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Serves fixed unit prices from {@code lending.oracle.static-prices}.
 * Bind a currency to it with the oracle identity {@value #ORACLE_IDENTITY}.
 */
@Component(StaticPriceOracle.ORACLE_IDENTITY)
@RequiredArgsConstructor
@Slf4j
public class StaticPriceOracle implements PriceOracle {

    public static final String ORACLE_IDENTITY = "staticPriceOracle";

    private final OracleProperties oracleProperties;

    @Override
    public long getPrice(String currencyCode, long amount) {
        Long price = oracleProperties.getStaticPrices().get(currencyCode);
        if (price == null) {
            log.warn("No static price configured for currency {}", currencyCode);
            return 0L;
        }
        return price;
    }
}

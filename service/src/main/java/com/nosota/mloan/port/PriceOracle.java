package com.nosota.mloan.port;

import com.nosota.mloan.error.ExternalServiceException;

/**
 * Price source for a collateral currency.
 *
 * <p>Implementations are Spring beans; the bean name is the oracle identity that
 * currencies are bound to through {@code CurrencyOracleBinding}.
 */
public interface PriceOracle {

    /**
     * Quotes the unit price of a currency for a given amount.
     *
     * @param currencyCode Currency to price
     * @param amount       Amount being valued
     * @return Unit price in value units, 0 when the oracle has no quote
     */
    long getPrice(String currencyCode, long amount) throws ExternalServiceException;
}

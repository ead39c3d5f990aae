package com.nosota.mloan.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price oracle configuration.
 *
 * <pre>
 * lending:
 *   oracle:
 *     bindings:            # currency -> oracle bean name, seeded into an empty binding table
 *       NATIVE: staticPriceOracle
 *     static-prices:       # unit prices served by the static oracle
 *       NATIVE: 1
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "lending.oracle")
public class OracleProperties {

    private Map<String, String> bindings = new LinkedHashMap<>();

    private Map<String, Long> staticPrices = new LinkedHashMap<>();
}

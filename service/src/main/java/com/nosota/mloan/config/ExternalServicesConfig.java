package com.nosota.mloan.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClients for the collaborators the engines consume over HTTP.
 *
 * <pre>
 * services:
 *   lending-pool:
 *     url: http://localhost:8081
 *   registry:
 *     url: http://localhost:8082
 *   repayment:
 *     url: http://localhost:8083
 * </pre>
 */
@Configuration
public class ExternalServicesConfig {

    @Bean
    public WebClient lendingPoolWebClient(WebClient.Builder builder,
                                          @Value("${services.lending-pool.url:http://localhost:8081}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public WebClient registryWebClient(WebClient.Builder builder,
                                       @Value("${services.registry.url:http://localhost:8082}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public WebClient repaymentWebClient(WebClient.Builder builder,
                                        @Value("${services.repayment.url:http://localhost:8083}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }
}

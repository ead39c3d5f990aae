package com.nosota.mloan.api;

import com.nosota.mloan.api.request.DepositCollateralRequest;
import com.nosota.mloan.api.request.UpdateLoanStatusRequest;
import com.nosota.mloan.api.request.WithdrawCollateralRequest;
import com.nosota.mloan.api.response.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of CollateralApi for consuming the mLoan collateral engine.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MLoanClientConfig {
 *     @Bean
 *     public WebClient mloanWebClient(WebClient.Builder builder,
 *                                     @Value("${services.mloan.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public CollateralClient collateralClient(WebClient mloanWebClient) {
 *         return new CollateralClient(mloanWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class CollateralClient implements CollateralApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<CollateralDepositResponse> depositCollateral(String caller, Long loanId,
                                                                       DepositCollateralRequest request) {
        log.debug("Calling depositCollateral: caller={}, loanId={}, amount={}, currency={}",
                caller, loanId, request.amount(), request.currencyCode());

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/deposits", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(CollateralDepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WithdrawalResponse> withdrawCollateral(String caller, Long loanId, Long collateralId,
                                                                 WithdrawCollateralRequest request) {
        log.debug("Calling withdrawCollateral: caller={}, loanId={}, collateralId={}, amount={}",
                caller, loanId, collateralId, request.amount());

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/deposits/{collateralId}/withdraw", loanId, collateralId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WithdrawalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> lockCollateral(String caller, Long loanId, Long collateralId) {
        log.debug("Calling lockCollateral: loanId={}, collateralId={}", loanId, collateralId);

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/deposits/{collateralId}/lock", loanId, collateralId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(CollateralDepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> unlockCollateral(String caller, Long loanId, Long collateralId) {
        log.debug("Calling unlockCollateral: loanId={}, collateralId={}", loanId, collateralId);

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/deposits/{collateralId}/unlock", loanId, collateralId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(CollateralDepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanStatusResponse> updateLoanStatus(String caller, Long loanId,
                                                               UpdateLoanStatusRequest request) {
        log.debug("Calling updateLoanStatus: loanId={}, status={}, referenceValue={}",
                loanId, request.status(), request.referenceValue());

        return webClient.put()
                .uri("/api/v1/collateral/loans/{loanId}/status", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReleaseResponse> releaseCollateral(String caller, Long loanId) {
        log.debug("Calling releaseCollateral: loanId={}", loanId);

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/release", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(ReleaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LiquidationResponse> liquidateCollateral(String caller, Long loanId) {
        log.debug("Calling liquidateCollateral: loanId={}", loanId);

        return webClient.post()
                .uri("/api/v1/collateral/loans/{loanId}/liquidate", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(LiquidationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> getCollateral(Long loanId, Long collateralId) {
        log.debug("Calling getCollateral: loanId={}, collateralId={}", loanId, collateralId);

        return webClient.get()
                .uri("/api/v1/collateral/loans/{loanId}/deposits/{collateralId}", loanId, collateralId)
                .retrieve()
                .toEntity(CollateralDepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<CollateralDepositResponse>> getLoanCollaterals(Long loanId) {
        log.debug("Calling getLoanCollaterals: loanId={}", loanId);

        return webClient.get()
                .uri("/api/v1/collateral/loans/{loanId}/deposits", loanId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<CollateralDepositResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<CollateralSummaryResponse> getLoanCollateralSum(Long loanId) {
        log.debug("Calling getLoanCollateralSum: loanId={}", loanId);

        return webClient.get()
                .uri("/api/v1/collateral/loans/{loanId}/summary", loanId)
                .retrieve()
                .toEntity(CollateralSummaryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanStatusResponse> getLoanStatus(Long loanId) {
        log.debug("Calling getLoanStatus: loanId={}", loanId);

        return webClient.get()
                .uri("/api/v1/collateral/loans/{loanId}/status", loanId)
                .retrieve()
                .toEntity(LoanStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralCheckResponse> isOverCollateralized(Long loanId) {
        log.debug("Calling isOverCollateralized: loanId={}", loanId);

        return webClient.get()
                .uri("/api/v1/collateral/loans/{loanId}/over-collateralized", loanId)
                .retrieve()
                .toEntity(CollateralCheckResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> getSettings() {
        return webClient.get()
                .uri("/api/v1/collateral/settings")
                .retrieve()
                .toEntity(CollateralSettingsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setAuthority(String caller, String authority) {
        return putSetting(caller, "authority", authority);
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setMinCollateralRatio(String caller, Integer ratio) {
        return putSetting(caller, "min-ratio", ratio);
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setMaxCollateralPerLoan(String caller, Long max) {
        return putSetting(caller, "max-per-loan", max);
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setLiquidationPenalty(String caller, Integer penalty) {
        return putSetting(caller, "liquidation-penalty", penalty);
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setCurrencyOracle(String caller, String currencyCode,
                                                                        String oracleIdentity) {
        log.debug("Calling setCurrencyOracle: currency={}, oracle={}", currencyCode, oracleIdentity);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/collateral/oracles/{currencyCode}")
                        .queryParam("oracle", oracleIdentity)
                        .build(currencyCode))
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(CollateralSettingsResponse.class)
                .block();
    }

    private ResponseEntity<CollateralSettingsResponse> putSetting(String caller, String setting, Object value) {
        log.debug("Calling collateral setting update: setting={}, value={}", setting, value);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/collateral/settings/{setting}")
                        .queryParam("value", value)
                        .build(setting))
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(CollateralSettingsResponse.class)
                .block();
    }
}

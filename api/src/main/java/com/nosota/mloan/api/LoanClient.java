package com.nosota.mloan.api;

import com.nosota.mloan.api.request.LoanRequest;
import com.nosota.mloan.api.request.RepaymentRequest;
import com.nosota.mloan.api.request.VoteRequest;
import com.nosota.mloan.api.response.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of LoanApi for consuming the mLoan loan lifecycle.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration, the same way as {@link CollateralClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class LoanClient implements LoanApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<LoanCreatedResponse> requestLoan(String caller, LoanRequest request) {
        log.debug("Calling requestLoan: borrower={}, amount={}, duration={}, collateral={}",
                caller, request.amount(), request.durationBlocks(), request.collateralAmount());

        return webClient.post()
                .uri("/api/v1/loans")
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanCreatedResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<VoteResponse> voteOnLoan(String caller, Long loanId, VoteRequest request) {
        log.debug("Calling voteOnLoan: voter={}, loanId={}, approve={}", caller, loanId, request.approve());

        return webClient.post()
                .uri("/api/v1/loans/{loanId}/votes", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(VoteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<FinalizationResponse> finalizeLoan(Long loanId) {
        log.debug("Calling finalizeLoan: loanId={}", loanId);

        return webClient.post()
                .uri("/api/v1/loans/{loanId}/finalize", loanId)
                .retrieve()
                .toEntity(FinalizationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanResponse> repayLoan(String caller, Long loanId, RepaymentRequest request) {
        log.debug("Calling repayLoan: caller={}, loanId={}, amount={}", caller, loanId, request.amount());

        return webClient.post()
                .uri("/api/v1/loans/{loanId}/repay", loanId)
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LiquidationResponse> markLoanDefault(Long loanId) {
        log.debug("Calling markLoanDefault: loanId={}", loanId);

        return webClient.post()
                .uri("/api/v1/loans/{loanId}/default", loanId)
                .retrieve()
                .toEntity(LiquidationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanResponse> getLoan(Long loanId) {
        log.debug("Calling getLoan: loanId={}", loanId);

        return webClient.get()
                .uri("/api/v1/loans/{loanId}", loanId)
                .retrieve()
                .toEntity(LoanResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ActiveLoanResponse> hasActiveLoan(String borrower) {
        log.debug("Calling hasActiveLoan: borrower={}", borrower);

        return webClient.get()
                .uri("/api/v1/loans/borrowers/{borrower}/active", borrower)
                .retrieve()
                .toEntity(ActiveLoanResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> getSettings() {
        return webClient.get()
                .uri("/api/v1/loans/settings")
                .retrieve()
                .toEntity(LoanSettingsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setAuthority(String caller, String authority) {
        return putSetting(caller, "authority", authority);
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setEngineIdentity(String caller, String engineIdentity) {
        return putSetting(caller, "engine-identity", engineIdentity);
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMaxLoanAmount(String caller, Long amount) {
        return putSetting(caller, "max-amount", amount);
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMaxLoanDuration(String caller, Long duration) {
        return putSetting(caller, "max-duration", duration);
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMinCollateralRatio(String caller, Integer ratio) {
        return putSetting(caller, "min-ratio", ratio);
    }

    private ResponseEntity<LoanSettingsResponse> putSetting(String caller, String setting, Object value) {
        log.debug("Calling loan setting update: setting={}, value={}", setting, value);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/loans/settings/{setting}")
                        .queryParam("value", value)
                        .build(setting))
                .header(LendingHeaders.CALLER_IDENTITY, caller)
                .retrieve()
                .toEntity(LoanSettingsResponse.class)
                .block();
    }
}

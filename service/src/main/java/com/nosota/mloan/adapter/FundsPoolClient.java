package com.nosota.mloan.adapter;

import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ExternalServiceException;
import com.nosota.mloan.port.FundsPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * {@link FundsPool} backed by the lending pool service.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET  /api/v1/pool/available-funds</li>
 *   <li>GET  /api/v1/pool/interest?principal=&amp;durationBlocks=</li>
 *   <li>POST /api/v1/pool/disbursements</li>
 * </ul>
 */
@Component
@Slf4j
public class FundsPoolClient implements FundsPool {

    private final WebClient webClient;

    public FundsPoolClient(@Qualifier("lendingPoolWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public long getAvailableFunds() throws ExternalServiceException {
        log.debug("Calling getAvailableFunds");

        AvailableFunds response = call("getAvailableFunds", () -> webClient.get()
                .uri("/api/v1/pool/available-funds")
                .retrieve()
                .bodyToMono(AvailableFunds.class)
                .block());
        return response.availableFunds();
    }

    @Override
    public long calculateInterest(long principal, long durationBlocks) throws ExternalServiceException {
        log.debug("Calling calculateInterest: principal={}, durationBlocks={}", principal, durationBlocks);

        InterestQuote response = call("calculateInterest", () -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/pool/interest")
                        .queryParam("principal", principal)
                        .queryParam("durationBlocks", durationBlocks)
                        .build())
                .retrieve()
                .bodyToMono(InterestQuote.class)
                .block());
        return response.interest();
    }

    @Override
    public boolean disburseFunds(long amount, String recipient) throws ExternalServiceException {
        log.debug("Calling disburseFunds: amount={}, recipient={}", amount, recipient);

        DisbursementResult response = call("disburseFunds", () -> webClient.post()
                .uri("/api/v1/pool/disbursements")
                .bodyValue(new DisbursementRequest(amount, recipient))
                .retrieve()
                .bodyToMono(DisbursementResult.class)
                .block());
        return response.disbursed();
    }

    private <T> T call(String operation, RemoteCall<T> remoteCall) throws ExternalServiceException {
        T response;
        try {
            response = remoteCall.execute();
        } catch (WebClientException e) {
            throw new ExternalServiceException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                    "Lending pool call " + operation + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ExternalServiceException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                    "Lending pool call " + operation + " returned no body");
        }
        return response;
    }

    record AvailableFunds(long availableFunds) {
    }

    record InterestQuote(long interest) {
    }

    record DisbursementRequest(long amount, String recipient) {
    }

    record DisbursementResult(boolean disbursed) {
    }
}

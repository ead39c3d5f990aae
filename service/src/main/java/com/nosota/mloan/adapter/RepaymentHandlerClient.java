package com.nosota.mloan.adapter;

import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ExternalServiceException;
import com.nosota.mloan.port.RepaymentHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * {@link RepaymentHandler} backed by the repayment service ({@code POST /api/v1/repayments}).
 */
@Component
@Slf4j
public class RepaymentHandlerClient implements RepaymentHandler {

    private final WebClient webClient;

    public RepaymentHandlerClient(@Qualifier("repaymentWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public boolean processRepayment(long loanId, long amount) throws ExternalServiceException {
        log.debug("Calling processRepayment: loanId={}, amount={}", loanId, amount);

        RepaymentResult response;
        try {
            response = webClient.post()
                    .uri("/api/v1/repayments")
                    .bodyValue(new RepaymentInstruction(loanId, amount))
                    .retrieve()
                    .bodyToMono(RepaymentResult.class)
                    .block();
        } catch (WebClientException e) {
            throw new ExternalServiceException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                    "Repayment call failed: " + e.getMessage(), e);
        }
        return response != null && response.accepted();
    }

    record RepaymentInstruction(long loanId, long amount) {
    }

    record RepaymentResult(boolean accepted) {
    }
}

package com.nosota.mloan.tests;

import com.nosota.mloan.TestBase;
import com.nosota.mloan.api.LendingHeaders;
import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.api.request.DepositCollateralRequest;
import com.nosota.mloan.api.request.UpdateLoanStatusRequest;
import com.nosota.mloan.api.request.WithdrawCollateralRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for CollateralController via REST API with MockMvc.
 *
 * <p>Covers the HTTP mapping of the collateral engine operations and of its error taxonomy.
 */
public class CollateralControllerTest extends TestBase {

    private static final String BASE = "/api/v1/collateral";
    private static final String DEPOSITOR = "depositor-1";

    @Test
    void depositAndReadCollateral() throws Exception {
        putStatus(3L, LoanStatus.ACTIVE, 1000L);

        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(2000L, "A"))))
                .andExpect(status().isCreated())
                .andExpect(header().exists("X-Correlation-Id"))
                .andExpect(jsonPath("$.collateralId").value(0))
                .andExpect(jsonPath("$.amount").value(2000))
                .andExpect(jsonPath("$.depositorIdentity").value(DEPOSITOR))
                .andExpect(jsonPath("$.locked").value(false));

        mockMvc.perform(get(BASE + "/loans/3/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAmount").value(2000))
                .andExpect(jsonPath("$.totalValue").value(2000))
                .andExpect(jsonPath("$.depositCount").value(1));

        mockMvc.perform(get(BASE + "/loans/3/deposits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get(BASE + "/loans/3/over-collateralized"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overCollateralized").value(true));

        mockMvc.perform(post(BASE + "/loans/3/deposits/0/withdraw")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new WithdrawCollateralRequest(500L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.withdrawnAmount").value(500))
                .andExpect(jsonPath("$.remainingAmount").value(1500));
    }

    @Test
    void errorsMapToStatusAndCode() throws Exception {
        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(2000L, "A"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LOAN_STATUS_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value(BASE + "/loans/3/deposits"));

        putStatus(3L, LoanStatus.ACTIVE, 1000L);

        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(1000L, "A"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("RATIO_BELOW_THRESHOLD"));

        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(0L, "A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ZERO_AMOUNT"));

        mockMvc.perform(post(BASE + "/loans/3/release")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));

        mockMvc.perform(post(BASE + "/loans/3/release")
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS"));

        tokenTransfer.declineAll();
        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(2000L, "A"))))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("TRANSFER_FAILED"));
    }

    @Test
    void malformedRequestsAreRejected() throws Exception {
        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DepositCollateralRequest(2000L, "A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post(BASE + "/loans/3/deposits")
                        .header(LendingHeaders.CALLER_IDENTITY, DEPOSITOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void lockLiquidateAndSettings() throws Exception {
        putStatus(4L, LoanStatus.ACTIVE, 1000L);
        collateralVaultService.depositCollateral(DEPOSITOR, 4L, 2000L, "A");

        mockMvc.perform(post(BASE + "/loans/4/deposits/0/lock")
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locked").value(true));

        putStatus(4L, LoanStatus.DEFAULTED, 1000L);
        mockMvc.perform(post(BASE + "/loans/4/liquidate")
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalLiquidated").value(2000))
                .andExpect(jsonPath("$.penaltyValue").value(100));

        mockMvc.perform(get(BASE + "/loans/4/status"))
                .andExpect(status().isNotFound());

        mockMvc.perform(put(BASE + "/settings/liquidation-penalty")
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE)
                        .param("value", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.liquidationPenalty").value(8));

        mockMvc.perform(put(BASE + "/oracles/D")
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE)
                        .param("oracle", "staticPriceOracle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currencyOracles.D").value("staticPriceOracle"));

        mockMvc.perform(get(BASE + "/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authority").value(ENGINE))
                .andExpect(jsonPath("$.maxDepositsPerLoan").value(100));

        assertThat(collateralSettings.getLiquidationPenalty()).isEqualTo(8);
    }

    private void putStatus(long loanId, LoanStatus loanStatus, long referenceValue) throws Exception {
        mockMvc.perform(put(BASE + "/loans/{loanId}/status", loanId)
                        .header(LendingHeaders.CALLER_IDENTITY, ENGINE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new UpdateLoanStatusRequest(loanStatus, referenceValue))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(loanStatus.name()));
    }
}

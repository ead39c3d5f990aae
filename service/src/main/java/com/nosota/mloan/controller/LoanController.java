package com.nosota.mloan.controller;

import com.nosota.mloan.api.LoanApi;
import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.api.request.LoanRequest;
import com.nosota.mloan.api.request.RepaymentRequest;
import com.nosota.mloan.api.request.VoteRequest;
import com.nosota.mloan.api.response.*;
import com.nosota.mloan.config.LoanSettings;
import com.nosota.mloan.dto.Liquidation;
import com.nosota.mloan.mapper.LoanMapper;
import com.nosota.mloan.model.LoanRecord;
import com.nosota.mloan.service.LoanManagerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
public class LoanController implements LoanApi {

    private final LoanManagerService loanManagerService;

    @Override
    public ResponseEntity<LoanCreatedResponse> requestLoan(String caller, LoanRequest request) throws Exception {
        long loanId = loanManagerService.requestLoan(caller, request.amount(), request.durationBlocks(),
                request.assetReference(), request.collateralAmount());
        LoanRecord loan = loanManagerService.getLoan(loanId);
        return ResponseEntity.status(HttpStatus.CREATED).body(new LoanCreatedResponse(
                loanId, loan.getStatus().name(), loan.getInterestAmount(), loan.getVotingDeadlineHeight()));
    }

    @Override
    public ResponseEntity<VoteResponse> voteOnLoan(String caller, Long loanId, VoteRequest request) throws Exception {
        LoanRecord loan = loanManagerService.voteOnLoan(caller, loanId, request.approve());
        return ResponseEntity.status(HttpStatus.CREATED).body(new VoteResponse(
                loanId, caller, request.approve(), loan.getVotesFor(), loan.getVotesAgainst()));
    }

    @Override
    public ResponseEntity<FinalizationResponse> finalizeLoan(Long loanId) throws Exception {
        boolean approved = loanManagerService.finalizeLoan(loanId);
        LoanStatus status = approved ? LoanStatus.ACTIVE : LoanStatus.REJECTED;
        return ResponseEntity.ok(new FinalizationResponse(loanId, approved, status.name()));
    }

    @Override
    public ResponseEntity<LoanResponse> repayLoan(String caller, Long loanId, RepaymentRequest request) throws Exception {
        LoanRecord loan = loanManagerService.repayLoan(caller, loanId, request.amount());
        return ResponseEntity.ok(LoanMapper.INSTANCE.toResponse(loan));
    }

    @Override
    public ResponseEntity<LiquidationResponse> markLoanDefault(Long loanId) throws Exception {
        Liquidation liquidation = loanManagerService.markLoanDefault(loanId);
        return ResponseEntity.ok(
                new LiquidationResponse(liquidation.loanId(), liquidation.totalLiquidated(), liquidation.penaltyValue()));
    }

    @Override
    public ResponseEntity<LoanResponse> getLoan(Long loanId) throws Exception {
        return ResponseEntity.ok(LoanMapper.INSTANCE.toResponse(loanManagerService.getLoan(loanId)));
    }

    @Override
    public ResponseEntity<ActiveLoanResponse> hasActiveLoan(String borrower) {
        return ResponseEntity.ok(new ActiveLoanResponse(borrower, loanManagerService.hasActiveLoan(borrower)));
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> getSettings() {
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setAuthority(String caller, String authority) throws Exception {
        loanManagerService.setAuthority(caller, authority);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setEngineIdentity(String caller, String engineIdentity) throws Exception {
        loanManagerService.setEngineIdentity(caller, engineIdentity);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMaxLoanAmount(String caller, Long amount) throws Exception {
        loanManagerService.setMaxLoanAmount(caller, amount);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMaxLoanDuration(String caller, Long duration) throws Exception {
        loanManagerService.setMaxLoanDuration(caller, duration);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<LoanSettingsResponse> setMinCollateralRatio(String caller, Integer ratio) throws Exception {
        loanManagerService.setMinCollateralRatio(caller, ratio);
        return ResponseEntity.ok(settingsResponse());
    }

    private LoanSettingsResponse settingsResponse() {
        LoanSettings settings = loanManagerService.getSettings();
        return new LoanSettingsResponse(
                settings.getAuthority(),
                settings.getEngineIdentity(),
                settings.getMaxLoanAmount(),
                settings.getMaxLoanDuration(),
                settings.getMinCollateralRatio(),
                settings.getVotingPeriodBlocks(),
                settings.getApprovalThresholdPercent(),
                settings.getCollateralCurrency());
    }
}

package com.nosota.mloan.controller;

import com.nosota.mloan.api.CollateralApi;
import com.nosota.mloan.api.request.DepositCollateralRequest;
import com.nosota.mloan.api.request.UpdateLoanStatusRequest;
import com.nosota.mloan.api.request.WithdrawCollateralRequest;
import com.nosota.mloan.api.response.*;
import com.nosota.mloan.config.CollateralSettings;
import com.nosota.mloan.dto.Liquidation;
import com.nosota.mloan.mapper.CollateralMapper;
import com.nosota.mloan.model.LoanStatusRecord;
import com.nosota.mloan.service.CollateralVaultService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
public class CollateralController implements CollateralApi {

    private final CollateralVaultService collateralVaultService;

    @Override
    public ResponseEntity<CollateralDepositResponse> depositCollateral(String caller, Long loanId,
                                                                       DepositCollateralRequest request) throws Exception {
        long collateralId = collateralVaultService.depositCollateral(
                caller, loanId, request.amount(), request.currencyCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(
                CollateralMapper.INSTANCE.toResponse(collateralVaultService.getCollateral(loanId, collateralId)));
    }

    @Override
    public ResponseEntity<WithdrawalResponse> withdrawCollateral(String caller, Long loanId, Long collateralId,
                                                                 WithdrawCollateralRequest request) throws Exception {
        long remaining = collateralVaultService.withdrawCollateral(caller, loanId, collateralId, request.amount());
        return ResponseEntity.ok(new WithdrawalResponse(loanId, collateralId, request.amount(), remaining));
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> lockCollateral(String caller, Long loanId,
                                                                    Long collateralId) throws Exception {
        collateralVaultService.lockCollateral(caller, loanId, collateralId);
        return ResponseEntity.ok(
                CollateralMapper.INSTANCE.toResponse(collateralVaultService.getCollateral(loanId, collateralId)));
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> unlockCollateral(String caller, Long loanId,
                                                                      Long collateralId) throws Exception {
        collateralVaultService.unlockCollateral(caller, loanId, collateralId);
        return ResponseEntity.ok(
                CollateralMapper.INSTANCE.toResponse(collateralVaultService.getCollateral(loanId, collateralId)));
    }

    @Override
    public ResponseEntity<LoanStatusResponse> updateLoanStatus(String caller, Long loanId,
                                                               UpdateLoanStatusRequest request) throws Exception {
        LoanStatusRecord statusRecord = collateralVaultService.updateLoanStatus(
                caller, loanId, request.status(), request.referenceValue());
        return ResponseEntity.ok(CollateralMapper.INSTANCE.toResponse(statusRecord));
    }

    @Override
    public ResponseEntity<ReleaseResponse> releaseCollateral(String caller, Long loanId) throws Exception {
        long totalReleased = collateralVaultService.releaseCollateral(caller, loanId);
        return ResponseEntity.ok(new ReleaseResponse(loanId, totalReleased));
    }

    @Override
    public ResponseEntity<LiquidationResponse> liquidateCollateral(String caller, Long loanId) throws Exception {
        Liquidation liquidation = collateralVaultService.liquidateCollateral(caller, loanId);
        return ResponseEntity.ok(
                new LiquidationResponse(liquidation.loanId(), liquidation.totalLiquidated(), liquidation.penaltyValue()));
    }

    @Override
    public ResponseEntity<CollateralDepositResponse> getCollateral(Long loanId, Long collateralId) throws Exception {
        return ResponseEntity.ok(
                CollateralMapper.INSTANCE.toResponse(collateralVaultService.getCollateral(loanId, collateralId)));
    }

    @Override
    public ResponseEntity<List<CollateralDepositResponse>> getLoanCollaterals(Long loanId) {
        return ResponseEntity.ok(
                CollateralMapper.INSTANCE.toResponseList(collateralVaultService.getLoanCollaterals(loanId)));
    }

    @Override
    public ResponseEntity<CollateralSummaryResponse> getLoanCollateralSum(Long loanId) {
        return ResponseEntity.ok(
                CollateralMapper.INSTANCE.toResponse(collateralVaultService.getLoanCollateralSum(loanId)));
    }

    @Override
    public ResponseEntity<LoanStatusResponse> getLoanStatus(Long loanId) throws Exception {
        return ResponseEntity.ok(CollateralMapper.INSTANCE.toResponse(collateralVaultService.getLoanStatus(loanId)));
    }

    @Override
    public ResponseEntity<CollateralCheckResponse> isOverCollateralized(Long loanId) {
        return ResponseEntity.ok(
                new CollateralCheckResponse(loanId, collateralVaultService.isOverCollateralized(loanId)));
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> getSettings() {
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setAuthority(String caller, String authority) throws Exception {
        collateralVaultService.setAuthority(caller, authority);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setMinCollateralRatio(String caller, Integer ratio) throws Exception {
        collateralVaultService.setMinCollateralRatio(caller, ratio);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setMaxCollateralPerLoan(String caller, Long max) throws Exception {
        collateralVaultService.setMaxCollateralPerLoan(caller, max);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setLiquidationPenalty(String caller, Integer penalty) throws Exception {
        collateralVaultService.setLiquidationPenalty(caller, penalty);
        return ResponseEntity.ok(settingsResponse());
    }

    @Override
    public ResponseEntity<CollateralSettingsResponse> setCurrencyOracle(String caller, String currencyCode,
                                                                        String oracleIdentity) throws Exception {
        collateralVaultService.setCurrencyOracle(caller, currencyCode, oracleIdentity);
        return ResponseEntity.ok(settingsResponse());
    }

    private CollateralSettingsResponse settingsResponse() {
        CollateralSettings settings = collateralVaultService.getSettings();
        return new CollateralSettingsResponse(
                settings.getAuthority(),
                settings.getMinCollateralRatio(),
                settings.getMaxCollateralPerLoan(),
                settings.getLiquidationPenalty(),
                CollateralSettings.MAX_DEPOSITS_PER_LOAN,
                collateralVaultService.getCurrencyOracles());
    }
}

package com.nosota.mloan.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class LendingConfig {

    @Bean
    public CollateralSettings collateralSettings(
            @Value("${lending.collateral.authority:loan-manager}") String authority,
            @Value("${lending.collateral.min-ratio:150}") int minCollateralRatio,
            @Value("${lending.collateral.max-per-loan:1000000}") long maxCollateralPerLoan,
            @Value("${lending.collateral.liquidation-penalty:5}") int liquidationPenalty,
            @Value("${lending.collateral.vault-identity:collateral-vault}") String vaultIdentity,
            @Value("${lending.collateral.pool-recipient:lending-pool}") String poolRecipient) {
        return new CollateralSettings(authority, minCollateralRatio, maxCollateralPerLoan,
                liquidationPenalty, vaultIdentity, poolRecipient);
    }

    @Bean
    public LoanSettings loanSettings(
            @Value("${lending.loans.authority:admin}") String authority,
            @Value("${lending.loans.engine-identity:loan-manager}") String engineIdentity,
            @Value("${lending.loans.max-amount:10000}") long maxLoanAmount,
            @Value("${lending.loans.max-duration:90}") long maxLoanDuration,
            @Value("${lending.loans.min-ratio:150}") int minCollateralRatio,
            @Value("${lending.loans.voting-period:100}") long votingPeriodBlocks,
            @Value("${lending.loans.approval-threshold:75}") int approvalThresholdPercent,
            @Value("${lending.loans.collateral-currency:NATIVE}") String collateralCurrency) {
        return new LoanSettings(authority, engineIdentity, maxLoanAmount, maxLoanDuration,
                minCollateralRatio, votingPeriodBlocks, approvalThresholdPercent, collateralCurrency);
    }
}

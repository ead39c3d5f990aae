package com.nosota.mloan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.config.CollateralSettings;
import com.nosota.mloan.config.LoanSettings;
import com.nosota.mloan.error.LendingException;
import com.nosota.mloan.model.CurrencyOracleBinding;
import com.nosota.mloan.repository.*;
import com.nosota.mloan.service.CollateralVaultService;
import com.nosota.mloan.service.LoanManagerService;
import com.nosota.mloan.support.*;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@SpringBootTest(
        classes = MloanApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@Testcontainers
@Import(TestCollaboratorsConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final String ENGINE = "loan-manager";
    protected static final String ADMIN = "admin";
    protected static final String VAULT = "collateral-vault";
    protected static final String POOL = "lending-pool";
    protected static final String BORROWER = "borrower-1";
    protected static final String ASSET = "asset-1";

    @Autowired
    protected CollateralVaultService collateralVaultService;

    @Autowired
    protected LoanManagerService loanManagerService;

    @Autowired
    protected CollateralDepositRepository depositRepository;

    @Autowired
    protected LoanCollateralSummaryRepository summaryRepository;

    @Autowired
    protected LoanStatusRecordRepository statusRepository;

    @Autowired
    protected CurrencyOracleBindingRepository oracleBindingRepository;

    @Autowired
    protected LoanRecordRepository loanRepository;

    @Autowired
    protected LoanVoteRepository voteRepository;

    @Autowired
    protected LoanSequenceRepository sequenceRepository;

    @Autowired
    protected TokenTransferRepository tokenTransferRepository;

    @Autowired
    protected CollateralSettings collateralSettings;

    @Autowired
    protected LoanSettings loanSettings;

    @Autowired
    protected MutableChainHeight chainHeight;

    @Autowired
    protected StubFundsPool fundsPool;

    @Autowired
    protected StubRegistry registry;

    @Autowired
    protected StubRepaymentHandler repaymentHandler;

    @Autowired
    protected MutablePriceOracle priceOracle;

    @Autowired
    protected FaultInjectingTokenTransfer tokenTransfer;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @BeforeEach
    public void resetState() {
        voteRepository.deleteAll();
        loanRepository.deleteAll();
        depositRepository.deleteAll();
        summaryRepository.deleteAll();
        statusRepository.deleteAll();
        sequenceRepository.deleteAll();
        tokenTransferRepository.deleteAll();
        oracleBindingRepository.deleteAll();

        oracleBindingRepository.save(new CurrencyOracleBinding("A", MutablePriceOracle.ORACLE_IDENTITY));
        oracleBindingRepository.save(new CurrencyOracleBinding("B", MutablePriceOracle.ORACLE_IDENTITY));

        collateralSettings.setAuthority(ENGINE);
        collateralSettings.setMinCollateralRatio(150);
        collateralSettings.setMaxCollateralPerLoan(1_000_000L);
        collateralSettings.setLiquidationPenalty(5);

        loanSettings.setAuthority(ADMIN);
        loanSettings.setEngineIdentity(ENGINE);
        loanSettings.setMaxLoanAmount(10_000L);
        loanSettings.setMaxLoanDuration(90L);
        loanSettings.setMinCollateralRatio(150);
        loanSettings.setVotingPeriodBlocks(100L);
        loanSettings.setApprovalThresholdPercent(75);
        loanSettings.setCollateralCurrency("A");

        chainHeight.set(0L);
        fundsPool.reset();
        registry.reset();
        repaymentHandler.reset();
        priceOracle.reset();
        tokenTransfer.reset();
    }

    /**
     * Writes a collateral status record through the authority.
     */
    protected void openLoanStatus(long loanId, LoanStatus status, long referenceValue) throws LendingException {
        collateralVaultService.updateLoanStatus(ENGINE, loanId, status, referenceValue);
    }

    /**
     * Requests a 1000 principal, 30 block loan secured by 1500 of currency A.
     */
    protected long requestStandardLoan(String borrower) throws LendingException {
        return loanManagerService.requestLoan(borrower, 1000L, 30L, ASSET, 1500L);
    }

    /**
     * Requests a standard loan, approves it with one vote and finalizes it after the deadline.
     */
    protected long activeLoan(String borrower) throws LendingException {
        long loanId = requestStandardLoan(borrower);
        loanManagerService.voteOnLoan("voter-approve-" + loanId, loanId, true);
        chainHeight.advance(loanSettings.getVotingPeriodBlocks() + 1);
        loanManagerService.finalizeLoan(loanId);
        return loanId;
    }

    /**
     * Sum of the live deposit amounts of a loan, read from the deposit rows.
     */
    protected long liveDepositTotal(long loanId) {
        return depositRepository.sumAmountByLoanId(loanId);
    }
}

package com.nosota.mloan.scheduler;

import com.nosota.mloan.service.LoanMaintenanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs advancing the loan lifecycle.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Finalize PENDING loans whose voting deadline has passed</li>
 *   <li>Default ACTIVE loans past maturity and liquidate their collateral</li>
 * </ul>
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   loan-lifecycle:
 *     enabled: true                      # enable/disable scheduler
 *     finalize-interval-ms: 60000
 *     default-interval-ms: 60000
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.loan-lifecycle.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class LoanLifecycleScheduler {

    private final LoanMaintenanceService loanMaintenanceService;

    @Scheduled(fixedDelayString = "${scheduler.loan-lifecycle.finalize-interval-ms:60000}")
    public void finalizeClosedVotes() {
        log.debug("Starting scheduled job: finalize loans with closed voting");

        try {
            int finalized = loanMaintenanceService.finalizeClosedVotes();
            if (finalized > 0) {
                log.info("Finalized {} loans", finalized);
            }
        } catch (Exception e) {
            log.error("Failed to finalize loans: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.loan-lifecycle.default-interval-ms:60000}")
    public void defaultMaturedLoans() {
        log.debug("Starting scheduled job: default matured loans");

        try {
            int defaulted = loanMaintenanceService.defaultMaturedLoans();
            if (defaulted > 0) {
                log.info("Defaulted {} matured loans", defaulted);
            }
        } catch (Exception e) {
            log.error("Failed to default matured loans: {}", e.getMessage(), e);
        }
    }
}

package com.nosota.mloan.scheduler;

import com.nosota.mloan.adapter.LocalChainHeight;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Produces blocks for a standalone deployment by advancing {@link LocalChainHeight}
 * once per {@code scheduler.chain-height.block-interval-ms}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "scheduler.chain-height.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ChainHeightTicker {

    private final LocalChainHeight localChainHeight;

    @Scheduled(fixedRateString = "${scheduler.chain-height.block-interval-ms:10000}")
    public void produceBlock() {
        localChainHeight.advance();
    }
}

package com.nosota.mloan.support;

import com.nosota.mloan.port.FundsPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lending pool with a fixed balance. Interest is 2% per 30 blocks, truncated.
 */
public class StubFundsPool implements FundsPool {

    public static final long DEFAULT_AVAILABLE_FUNDS = 50_000L;

    private volatile long availableFunds = DEFAULT_AVAILABLE_FUNDS;
    private volatile boolean declineDisbursements;
    private final List<Disbursement> disbursements = Collections.synchronizedList(new ArrayList<>());

    @Override
    public long getAvailableFunds() {
        return availableFunds;
    }

    @Override
    public long calculateInterest(long principal, long durationBlocks) {
        return principal * 2 * durationBlocks / 3000;
    }

    @Override
    public boolean disburseFunds(long amount, String recipient) {
        if (declineDisbursements) {
            return false;
        }
        disbursements.add(new Disbursement(amount, recipient));
        availableFunds -= amount;
        return true;
    }

    public void setAvailableFunds(long availableFunds) {
        this.availableFunds = availableFunds;
    }

    public void setDeclineDisbursements(boolean declineDisbursements) {
        this.declineDisbursements = declineDisbursements;
    }

    public List<Disbursement> getDisbursements() {
        return List.copyOf(disbursements);
    }

    public void reset() {
        availableFunds = DEFAULT_AVAILABLE_FUNDS;
        declineDisbursements = false;
        disbursements.clear();
    }

    public record Disbursement(long amount, String recipient) {
    }
}

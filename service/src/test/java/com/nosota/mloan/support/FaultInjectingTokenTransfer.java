package com.nosota.mloan.support;

import com.nosota.mloan.adapter.LedgerTokenTransfer;
import com.nosota.mloan.port.TokenTransfer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegates to the ledger, declining transfers once {@link #declineAfter(int)} successful
 * transfers have been executed.
 */
public class FaultInjectingTokenTransfer implements TokenTransfer {

    private final LedgerTokenTransfer delegate;
    private final AtomicInteger remainingBeforeDecline = new AtomicInteger(-1);

    public FaultInjectingTokenTransfer(LedgerTokenTransfer delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean transfer(String currencyCode, long amount, String fromIdentity, String toIdentity) {
        int remaining = remainingBeforeDecline.get();
        if (remaining == 0) {
            return false;
        }
        if (remaining > 0) {
            remainingBeforeDecline.decrementAndGet();
        }
        return delegate.transfer(currencyCode, amount, fromIdentity, toIdentity);
    }

    public void declineAfter(int successfulTransfers) {
        remainingBeforeDecline.set(successfulTransfers);
    }

    public void declineAll() {
        declineAfter(0);
    }

    public void reset() {
        remainingBeforeDecline.set(-1);
    }
}

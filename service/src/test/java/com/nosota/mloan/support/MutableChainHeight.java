package com.nosota.mloan.support;

import com.nosota.mloan.port.ChainHeight;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Chain height that tests move explicitly.
 */
public class MutableChainHeight implements ChainHeight {

    private final AtomicLong height = new AtomicLong();

    @Override
    public long current() {
        return height.get();
    }

    public void set(long newHeight) {
        height.set(newHeight);
    }

    public void advance(long blocks) {
        height.addAndGet(blocks);
    }
}

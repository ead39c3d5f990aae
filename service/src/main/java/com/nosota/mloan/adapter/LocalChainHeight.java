package com.nosota.mloan.adapter;

import com.nosota.mloan.port.ChainHeight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Height counter of a standalone deployment, advanced by {@code ChainHeightTicker}.
 */
@Component
@Slf4j
public class LocalChainHeight implements ChainHeight {

    private final AtomicLong height;

    public LocalChainHeight(@Value("${lending.chain.initial-height:0}") long initialHeight) {
        this.height = new AtomicLong(initialHeight);
    }

    @Override
    public long current() {
        return height.get();
    }

    /**
     * Advances the height by one block.
     *
     * @return The new height
     */
    public long advance() {
        long next = height.incrementAndGet();
        log.trace("Chain height advanced to {}", next);
        return next;
    }
}

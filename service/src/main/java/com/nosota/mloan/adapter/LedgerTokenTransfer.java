package com.nosota.mloan.adapter;

import com.nosota.mloan.model.TokenTransferEntry;
import com.nosota.mloan.port.ChainHeight;
import com.nosota.mloan.port.TokenTransfer;
import com.nosota.mloan.repository.TokenTransferRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

/**
 * Executes value movements as journal entries in the service database.
 *
 * <p>Entries are written in the caller's transaction, so a movement disappears
 * together with the engine state change that requested it when that change rolls back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerTokenTransfer implements TokenTransfer {

    private final TokenTransferRepository tokenTransferRepository;
    private final ChainHeight chainHeight;

    @Override
    @Transactional
    public boolean transfer(String currencyCode, long amount, String from, String to) {
        if (amount <= 0 || !StringUtils.hasText(currencyCode)
                || !StringUtils.hasText(from) || !StringUtils.hasText(to) || from.equals(to)) {
            log.warn("Declined transfer of {} {} from {} to {}", amount, currencyCode, from, to);
            return false;
        }

        TokenTransferEntry entry = new TokenTransferEntry();
        entry.setCurrencyCode(currencyCode);
        entry.setAmount(amount);
        entry.setFromIdentity(from);
        entry.setToIdentity(to);
        entry.setHeight(chainHeight.current());
        entry.setCreatedAt(LocalDateTime.now());
        tokenTransferRepository.save(entry);

        log.debug("Transferred {} {} from {} to {}", amount, currencyCode, from, to);
        return true;
    }
}

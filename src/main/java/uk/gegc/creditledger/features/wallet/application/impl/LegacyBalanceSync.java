package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.wallet.domain.model.LegacyBalance;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.infra.repository.LegacyBalanceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Keeps {@code user_credits.credits} equal to subscription + top-up.
 * Called inside the transaction of every wallet mutation, after the wallet row is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyBalanceSync {

    private final LegacyBalanceRepository legacyBalanceRepository;
    private final Clock clock;

    public void sync(Wallet wallet) {
        LegacyBalance legacy = legacyBalanceRepository.findById(wallet.getUserId()).orElseGet(() -> {
            LegacyBalance created = new LegacyBalance();
            created.setUserId(wallet.getUserId());
            return created;
        });
        int total = wallet.getTotalCredits();
        if (legacy.getCredits() != total) {
            log.debug("Legacy balance for user {}: {} -> {}", wallet.getUserId(), legacy.getCredits(), total);
        }
        legacy.setCredits(total);
        legacy.setUpdatedAt(LocalDateTime.now(clock));
        legacyBalanceRepository.save(legacy);
    }

    /**
     * Single-number balance as stored, 0 when the user never had one.
     */
    public int legacyCredits(UUID userId) {
        return legacyBalanceRepository.findById(userId)
                .map(LegacyBalance::getCredits)
                .orElse(0);
    }
}

package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.wallet.application.CreditsProperties;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerSources;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;
import uk.gegc.creditledger.features.wallet.infra.repository.WalletRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Owns the per-user wallet row.
 * <p>
 * A wallet is created lazily on first use. Its top-up pool starts with the user's legacy
 * single-number balance (negative values count as 0), its subscription pool with 0 and its
 * grace limit with {@code credits.default-grace-limit}. The legacy balance is rewritten to the
 * new total on creation, so a negative legacy value becomes 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletStore {

    private final WalletRepository walletRepository;
    private final LegacyBalanceSync legacyBalanceSync;
    private final LedgerWriter ledgerWriter;
    private final CreditsProperties creditsProperties;
    private final Clock clock;

    /**
     * Returns the user's wallet locked for update, creating it first if needed.
     * The lock is held until the caller's transaction completes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet getOrCreate(UUID userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        boolean created = !walletRepository.existsByUserId(userId) && provision(userId);
        Wallet wallet = walletRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Wallet for user " + userId + " missing after provisioning"));
        if (created) {
            legacyBalanceSync.sync(wallet);
        }
        return wallet;
    }

    /**
     * Unlocked read. When the wallet does not exist yet, returns an unsaved wallet
     * showing what {@link #getOrCreate} would create.
     */
    @Transactional(readOnly = true)
    public Wallet peek(UUID userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        return walletRepository.findByUserId(userId).orElseGet(() -> newWallet(userId));
    }

    /**
     * Inserts the wallet row unless it exists. Returns false when a concurrent transaction won the insert.
     */
    private boolean provision(UUID userId) {
        int migrated = Math.max(legacyBalanceSync.legacyCredits(userId), 0);
        LocalDateTime now = LocalDateTime.now(clock);

        int inserted = walletRepository.insertIfAbsent(userId, migrated, creditsProperties.getDefaultGraceLimit(), now);
        if (inserted == 0) {
            log.debug("Wallet for user {} was created by a concurrent transaction", userId);
            return false;
        }

        log.info("Created wallet for user {} with {} credits migrated from legacy balance and grace limit {}",
                userId, migrated, creditsProperties.getDefaultGraceLimit());
        if (migrated > 0) {
            ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.TOPUP, LedgerEntryKind.CREDIT)
                    .amount(migrated)
                    .balanceBefore(0)
                    .balanceAfter(migrated)
                    .sourceType(LedgerSources.LEGACY_MIGRATION)
                    .description("Legacy balance migration")
                    .build());
        }
        return true;
    }

    private Wallet newWallet(UUID userId) {
        Wallet wallet = new Wallet();
        wallet.setUserId(userId);
        wallet.setSubscriptionCredits(0);
        wallet.setTopUpCredits(Math.max(legacyBalanceSync.legacyCredits(userId), 0));
        wallet.setGraceLimit(creditsProperties.getDefaultGraceLimit());
        wallet.setGraceUsed(0);
        return wallet;
    }
}

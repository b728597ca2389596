package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.wallet.application.LedgerStructuredLogger;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;
import uk.gegc.creditledger.features.wallet.infra.repository.LedgerEntryRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * The only write path for {@link LedgerEntry}. Entries are inserted, never updated or deleted.
 */
@Component
@RequiredArgsConstructor
public class LedgerWriter {

    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    /**
     * Builder pre-filled with user, pool, kind and the current time.
     */
    public LedgerEntry.LedgerEntryBuilder entry(UUID userId, WalletPool pool, LedgerEntryKind kind) {
        return LedgerEntry.builder()
                .userId(userId)
                .pool(pool)
                .kind(kind)
                .createdAt(LocalDateTime.now(clock));
    }

    public LedgerEntry append(LedgerEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Ledger entries are append-only; entry " + entry.getId() + " already exists");
        }
        if (entry.getAmount() < 0 || (entry.getAmount() == 0 && entry.getKind() != LedgerEntryKind.RESET)) {
            throw new IllegalArgumentException("Ledger amount must be positive for " + entry.getKind() + ", was " + entry.getAmount());
        }

        LedgerEntry saved = ledgerEntryRepository.save(entry);

        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Ledger {} {} of {} credits for user {} ({} -> {})",
                saved.getUserId(), saved.getPool().name(), saved.getKind().name(), saved.getAmount(),
                saved.getSourceType(), saved.getSourceId(), saved.getBalanceAfter(),
                saved.getPool(), saved.getKind(), saved.getAmount(), saved.getUserId(),
                saved.getBalanceBefore(), saved.getBalanceAfter());
        return saved;
    }

    /**
     * Newest first.
     */
    public List<LedgerEntry> history(UUID userId, int limit) {
        return ledgerEntryRepository.findByUserIdOrderByIdDesc(userId, PageRequest.of(0, limit));
    }

    /**
     * Oldest first, the order in which entries were appended.
     */
    public List<LedgerEntry> replayOrder(UUID userId) {
        return ledgerEntryRepository.findByUserIdOrderByIdAsc(userId);
    }
}

package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds pool balances from ledger entries in append order, starting from 0.
 * <ul>
 *     <li>CREDIT, REFUND: add amount</li>
 *     <li>DEBIT: subtract amount, except grace entries which are balance-neutral</li>
 *     <li>RESET: balance becomes amount, the previous balance is forfeited</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class LedgerReplayer {

    static final String GRACE_FLAG = "graceUsed";

    private final LedgerMetadataCodec metadataCodec;

    public ReplayedBalances replay(List<LedgerEntry> entriesInAppendOrder) {
        Map<WalletPool, Long> balances = new EnumMap<>(WalletPool.class);
        long forfeited = 0;
        long graceDrawn = 0;

        for (LedgerEntry entry : entriesInAppendOrder) {
            long current = balances.getOrDefault(entry.getPool(), 0L);
            switch (entry.getKind()) {
                case CREDIT, REFUND -> balances.put(entry.getPool(), current + entry.getAmount());
                case DEBIT -> {
                    if (isGraceEntry(entry)) {
                        graceDrawn += entry.getAmount();
                    } else {
                        balances.put(entry.getPool(), current - entry.getAmount());
                    }
                }
                case RESET -> {
                    forfeited += current;
                    balances.put(entry.getPool(), (long) entry.getAmount());
                }
            }
        }

        return new ReplayedBalances(
                balances.getOrDefault(WalletPool.SUBSCRIPTION, 0L),
                balances.getOrDefault(WalletPool.TOPUP, 0L),
                forfeited,
                graceDrawn
        );
    }

    public boolean isGraceEntry(LedgerEntry entry) {
        return entry.getKind() == LedgerEntryKind.DEBIT
                && Boolean.TRUE.equals(metadataCodec.read(entry.getMetadata()).get(GRACE_FLAG));
    }

    public record ReplayedBalances(long subscriptionCredits, long topUpCredits, long forfeitedCredits, long graceDrawn) {
    }
}

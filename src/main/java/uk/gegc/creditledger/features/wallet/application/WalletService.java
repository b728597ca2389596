package uk.gegc.creditledger.features.wallet.application;

import uk.gegc.creditledger.features.wallet.api.dto.DeductResultDto;
import uk.gegc.creditledger.features.wallet.api.dto.LedgerEntryDto;
import uk.gegc.creditledger.features.wallet.api.dto.WalletBalanceDto;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.util.List;
import java.util.UUID;

/**
 * Balance reads and pool mutations for a user's two-pool wallet.
 * <p>
 * Every mutating method runs in one transaction that locks the wallet row, writes the wallet,
 * appends ledger entries and rewrites the legacy balance. A failure rolls back all of it.
 */
public interface WalletService {

    /**
     * Current balance. Does not create the wallet.
     */
    WalletBalanceDto getBalance(UUID userId);

    /**
     * True when subscription + top-up + remaining grace covers {@code cost}. No side effects.
     */
    boolean hasCredits(UUID userId, int cost);

    /**
     * Deducts {@code cost} from subscription, then top-up, then grace.
     *
     * @throws uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException when cost &lt;= 0
     * @throws uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException when the
     *         cost exceeds both pools plus remaining grace; nothing is changed
     */
    DeductResultDto deductCredits(UUID userId, int cost, String sourceType, String sourceId, String description);

    /**
     * Adds purchased credits to the top-up pool.
     */
    void addTopUpCredits(UUID userId, int amount, String sourceId, String description);

    /**
     * Returns credits to the top-up pool, whichever pool they were originally taken from.
     * {@code originalPool} is kept in the entry's metadata.
     */
    void refundCredits(UUID userId, int amount, WalletPool originalPool, String reason, String sourceId);

    /**
     * Newest first. {@code limit} below 1 means the configured default; values above the
     * configured maximum are capped.
     */
    List<LedgerEntryDto> getTransactionHistory(UUID userId, int limit);
}

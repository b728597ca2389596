package uk.gegc.creditledger.features.subscription.application;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Billing cycle operations on the subscription pool, called by the billing integration
 * on subscription lifecycle events.
 * <p>
 * Webhooks arrive at least once. Callers that cannot supply their own guard use
 * {@link #applyInitialGrant} and {@link #applyRenewal}, which record the billing period
 * before touching the wallet.
 */
public interface SubscriptionCycleService {

    /**
     * Sets the subscription pool to {@code credits}. The pool must be empty.
     *
     * @throws uk.gegc.creditledger.features.subscription.domain.exception.SubscriptionCreditsAlreadyGrantedException
     *         when the wallet already holds subscription credits
     */
    void grantInitialSubscriptionCredits(UUID userId, int credits, LocalDateTime expiresAt, String sourceId);

    /**
     * Overwrites the subscription pool with {@code planLimit}; unused credits are forfeited.
     * Calling it twice leaves the pool at {@code planLimit}.
     */
    void resetSubscriptionCredits(UUID userId, int planLimit, LocalDateTime expiresAt, String sourceId);

    /**
     * Empties the subscription pool and clears its expiry. No-op when the pool is already empty.
     */
    void revokeSubscriptionCredits(UUID userId, String reason);

    /**
     * Initial grant guarded by the (subscriptionId, periodStart) key.
     *
     * @return false when this period was already applied
     */
    boolean applyInitialGrant(UUID userId, String subscriptionId, LocalDateTime periodStart,
                              int credits, LocalDateTime expiresAt);

    /**
     * Renewal reset guarded by the (subscriptionId, periodStart) key.
     *
     * @return false when this period was already applied
     */
    boolean applyRenewal(UUID userId, String subscriptionId, LocalDateTime periodStart,
                         int planLimit, LocalDateTime expiresAt);
}

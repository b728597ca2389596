package uk.gegc.creditledger.features.subscription.domain.exception;

import java.util.UUID;

/**
 * Initial grant attempted on a wallet that still holds subscription credits.
 */
public class SubscriptionCreditsAlreadyGrantedException extends RuntimeException {

    private final UUID userId;
    private final int currentSubscriptionCredits;

    public SubscriptionCreditsAlreadyGrantedException(UUID userId, int currentSubscriptionCredits) {
        super("User " + userId + " already holds " + currentSubscriptionCredits
                + " subscription credits; use a reset for renewals");
        this.userId = userId;
        this.currentSubscriptionCredits = currentSubscriptionCredits;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getCurrentSubscriptionCredits() {
        return currentSubscriptionCredits;
    }
}

package uk.gegc.creditledger.features.wallet.domain.model;

/**
 * Outcome of splitting a cost across subscription, top-up and grace.
 */
public record DeductionPlan(
        int subscriptionDeducted,
        int topUpDeducted,
        int graceUsed,
        int newSubscriptionBalance,
        int newTopUpBalance,
        int newGraceLimit
) {
    public int totalDeducted() {
        return subscriptionDeducted + topUpDeducted + graceUsed;
    }

    public boolean usesGrace() {
        return graceUsed > 0;
    }
}

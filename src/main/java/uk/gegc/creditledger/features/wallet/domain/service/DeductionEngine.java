package uk.gegc.creditledger.features.wallet.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.features.wallet.domain.model.DeductionPlan;

/**
 * Splits a cost across the pools in a fixed order: subscription, then top-up, then grace.
 * Grace is only drawn when the whole remainder fits into it.
 * <p>
 * Pure function of its inputs; persistence is the caller's job.
 */
@Component
public class DeductionEngine {

    public DeductionPlan plan(int subscriptionCredits, int topUpCredits, int graceLimit, int cost) {
        if (cost <= 0) {
            throw new InvalidAmountException("cost", cost);
        }

        int subscriptionDeducted = Math.min(subscriptionCredits, cost);
        int remaining = cost - subscriptionDeducted;

        int topUpDeducted = Math.min(topUpCredits, remaining);
        remaining -= topUpDeducted;

        if (remaining > graceLimit) {
            throw new InsufficientCreditsException(cost, (long) subscriptionCredits + topUpCredits);
        }

        return new DeductionPlan(
                subscriptionDeducted,
                topUpDeducted,
                remaining,
                subscriptionCredits - subscriptionDeducted,
                topUpCredits - topUpDeducted,
                graceLimit - remaining
        );
    }

    /**
     * Pre-flight check matching {@link #plan}: true when the cost would be accepted.
     */
    public boolean canAfford(int subscriptionCredits, int topUpCredits, int graceLimit, int cost) {
        return (long) subscriptionCredits + topUpCredits + graceLimit >= cost;
    }
}

package uk.gegc.creditledger.features.subscription.domain.exception;

import java.time.LocalDateTime;

/**
 * A concurrent delivery claimed the same billing period first. The losing transaction rolls back.
 */
public class BillingPeriodAlreadyAppliedException extends RuntimeException {

    private final String subscriptionId;
    private final LocalDateTime periodStart;

    public BillingPeriodAlreadyAppliedException(String subscriptionId, LocalDateTime periodStart, Throwable cause) {
        super("Billing period " + periodStart + " of subscription " + subscriptionId + " was already applied", cause);
        this.subscriptionId = subscriptionId;
        this.periodStart = periodStart;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public LocalDateTime getPeriodStart() {
        return periodStart;
    }
}

package uk.gegc.creditledger.features.wallet.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

/**
 * Micrometer-backed credit metrics. Amount counters count credits, event counters count calls.
 */
@Slf4j
@Service
public class CreditMetricsServiceImpl implements CreditMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter graceConsumedCounter;
    private final Counter topUpAddedCounter;
    private final Counter refundedCounter;
    private final Counter reservationCreatedCounter;
    private final Counter reservationCapturedCounter;
    private final Counter reservationReleasedCounter;
    private final Counter subscriptionGrantedCounter;
    private final Counter subscriptionResetCounter;
    private final Counter subscriptionForfeitedCounter;
    private final Counter subscriptionRevokedCounter;
    private final Counter reconciliationSuccessCounter;
    private final Counter reconciliationDriftCounter;
    private final Counter reconciliationFailureCounter;
    private final DistributionSummary reconciliationDriftSummary;

    public CreditMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.graceConsumedCounter = Counter.builder("credits.grace.consumed")
                .description("Credits drawn from grace overdraft")
                .register(meterRegistry);
        this.topUpAddedCounter = Counter.builder("credits.topup.added")
                .description("Credits added to top-up pools by purchases")
                .register(meterRegistry);
        this.refundedCounter = Counter.builder("credits.refunded")
                .description("Credits refunded to top-up pools")
                .register(meterRegistry);
        this.reservationCreatedCounter = Counter.builder("credits.reservations.created")
                .description("Reservations created")
                .register(meterRegistry);
        this.reservationCapturedCounter = Counter.builder("credits.reservations.captured")
                .description("Reservations captured")
                .register(meterRegistry);
        this.reservationReleasedCounter = Counter.builder("credits.reservations.released")
                .description("Reservations released and refunded")
                .register(meterRegistry);
        this.subscriptionGrantedCounter = Counter.builder("credits.subscription.granted")
                .description("Credits granted on first subscription")
                .register(meterRegistry);
        this.subscriptionResetCounter = Counter.builder("credits.subscription.reset")
                .description("Subscription pool resets")
                .register(meterRegistry);
        this.subscriptionForfeitedCounter = Counter.builder("credits.subscription.forfeited")
                .description("Unused subscription credits forfeited at reset")
                .register(meterRegistry);
        this.subscriptionRevokedCounter = Counter.builder("credits.subscription.revoked")
                .description("Subscription credits revoked after failed payment")
                .register(meterRegistry);
        this.reconciliationSuccessCounter = Counter.builder("credits.reconciliation.success")
                .description("Wallets whose ledger replay matched stored balances")
                .register(meterRegistry);
        this.reconciliationDriftCounter = Counter.builder("credits.reconciliation.drift")
                .description("Wallets whose ledger replay did not match stored balances")
                .register(meterRegistry);
        this.reconciliationFailureCounter = Counter.builder("credits.reconciliation.failure")
                .description("Wallets that could not be reconciled")
                .register(meterRegistry);
        this.reconciliationDriftSummary = DistributionSummary.builder("credits.reconciliation.drift.amount")
                .description("Absolute drift found per wallet")
                .register(meterRegistry);
    }

    @Override
    public void incrementCreditsDeducted(WalletPool pool, int amount, String sourceType) {
        Counter.builder("credits.deducted")
                .description("Credits deducted from a pool")
                .tag("pool", pool.name())
                .tag("source", sourceType != null ? sourceType : "UNKNOWN")
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void incrementGraceConsumed(int amount) {
        graceConsumedCounter.increment(amount);
    }

    @Override
    public void incrementDeductionRejected(String sourceType) {
        Counter.builder("credits.deductions.rejected")
                .description("Deductions rejected for insufficient credits")
                .tag("source", sourceType != null ? sourceType : "UNKNOWN")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementTopUpAdded(int amount) {
        topUpAddedCounter.increment(amount);
    }

    @Override
    public void incrementCreditsRefunded(int amount) {
        refundedCounter.increment(amount);
    }

    @Override
    public void incrementReservationCreated() {
        reservationCreatedCounter.increment();
    }

    @Override
    public void incrementReservationCaptured() {
        reservationCapturedCounter.increment();
    }

    @Override
    public void incrementReservationReleased() {
        reservationReleasedCounter.increment();
    }

    @Override
    public void incrementSubscriptionGranted(int amount) {
        subscriptionGrantedCounter.increment(amount);
    }

    @Override
    public void incrementSubscriptionReset(int planLimit, int expiredCredits) {
        subscriptionResetCounter.increment();
        subscriptionForfeitedCounter.increment(expiredCredits);
    }

    @Override
    public void incrementSubscriptionRevoked(int amount) {
        subscriptionRevokedCounter.increment(amount);
    }

    @Override
    public void incrementBillingPeriodDuplicate(String grantType) {
        Counter.builder("credits.billing_period.duplicates")
                .description("Billing period deliveries ignored as already applied")
                .tag("type", grantType)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordReconciliationSuccess() {
        reconciliationSuccessCounter.increment();
    }

    @Override
    public void recordReconciliationDrift(long driftAmount) {
        reconciliationDriftCounter.increment();
        reconciliationDriftSummary.record(Math.abs(driftAmount));
        log.debug("Recorded reconciliation drift of {} credits", driftAmount);
    }

    @Override
    public void recordReconciliationFailure() {
        reconciliationFailureCounter.increment();
    }
}

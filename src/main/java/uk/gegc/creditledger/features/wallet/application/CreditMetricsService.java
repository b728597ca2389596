package uk.gegc.creditledger.features.wallet.application;

import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

/**
 * Counters for credit movements, reservations, billing cycles and reconciliation.
 */
public interface CreditMetricsService {

    /**
     * Deductions.
     */
    void incrementCreditsDeducted(WalletPool pool, int amount, String sourceType);
    void incrementGraceConsumed(int amount);
    void incrementDeductionRejected(String sourceType);

    /**
     * Credits entering a pool.
     */
    void incrementTopUpAdded(int amount);
    void incrementCreditsRefunded(int amount);

    /**
     * Reservations.
     */
    void incrementReservationCreated();
    void incrementReservationCaptured();
    void incrementReservationReleased();

    /**
     * Billing cycle.
     */
    void incrementSubscriptionGranted(int amount);
    void incrementSubscriptionReset(int planLimit, int expiredCredits);
    void incrementSubscriptionRevoked(int amount);
    void incrementBillingPeriodDuplicate(String grantType);

    /**
     * Ledger replay reconciliation.
     */
    void recordReconciliationSuccess();
    void recordReconciliationDrift(long driftAmount);
    void recordReconciliationFailure();
}

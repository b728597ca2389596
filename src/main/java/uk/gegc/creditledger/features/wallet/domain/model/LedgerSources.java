package uk.gegc.creditledger.features.wallet.domain.model;

/**
 * Source types written by the ledger itself. Callers of deductions and reservations pass their own.
 */
public final class LedgerSources {

    public static final String PAYMENT = "PAYMENT";
    public static final String SUBSCRIPTION_CYCLE = "SUBSCRIPTION_CYCLE";
    public static final String SYSTEM = "SYSTEM";
    public static final String LEGACY_MIGRATION = "LEGACY_MIGRATION";

    private LedgerSources() {
    }
}

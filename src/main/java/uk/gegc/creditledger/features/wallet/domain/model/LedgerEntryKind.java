package uk.gegc.creditledger.features.wallet.domain.model;

/**
 * Kind of a ledger entry. Replay rules per pool:
 * CREDIT and REFUND add, DEBIT subtracts (grace entries excepted), RESET sets the balance.
 */
public enum LedgerEntryKind {
    CREDIT,
    DEBIT,
    REFUND,
    RESET
}

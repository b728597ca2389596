package uk.gegc.creditledger.features.wallet.domain.model;

public enum WalletPool {
    SUBSCRIPTION,
    TOPUP
}

package uk.gegc.creditledger.features.subscription.domain.model;

public enum PeriodGrantType {
    INITIAL,
    RENEWAL
}

package uk.gegc.creditledger.features.wallet.api.dto;

public record DeductResultDto(
        int subscriptionDeducted,
        int topUpDeducted,
        int graceUsed,
        int totalDeducted,
        int newSubscriptionBalance,
        int newTopUpBalance
) {
    public int balanceAfter() {
        return newSubscriptionBalance + newTopUpBalance;
    }
}

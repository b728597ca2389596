package uk.gegc.creditledger.features.wallet.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "WalletBalanceDto", description = "User's credit balance across both pools")
public record WalletBalanceDto(
        @Schema(description = "User UUID")
        UUID userId,

        @Schema(description = "Credits granted for the current billing period", example = "70")
        int subscriptionCredits,

        @Schema(description = "Purchased credits, never expire", example = "20")
        int topUpCredits,

        @Schema(description = "Subscription plus top-up credits", example = "90")
        int totalCredits,

        @Schema(description = "Remaining overdraft allowance", example = "50")
        int graceLimit,

        @Schema(description = "Overdraft consumed so far", example = "0")
        int graceUsed,

        @Schema(description = "When the current subscription credits expire")
        LocalDateTime subscriptionExpiresAt,

        @Schema(description = "Last balance update timestamp")
        LocalDateTime updatedAt
) {}

package uk.gegc.creditledger.features.wallet.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "LedgerEntryDto", description = "One immutable credit movement")
public record LedgerEntryDto(
        Long id,
        UUID userId,
        WalletPool pool,
        LedgerEntryKind kind,
        int amount,
        int balanceBefore,
        int balanceAfter,
        String sourceType,
        String sourceId,
        String description,
        @Schema(description = "Entry metadata as JSON text")
        String metadata,
        LocalDateTime createdAt
) {}

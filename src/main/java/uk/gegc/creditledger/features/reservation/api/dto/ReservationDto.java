package uk.gegc.creditledger.features.reservation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.creditledger.features.reservation.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "ReservationDto", description = "Credits held for pending work")
public record ReservationDto(
        UUID id,
        UUID userId,
        ReservationStatus status,
        @Schema(description = "Credits deducted at reservation time", example = "4")
        int cost,
        @Schema(description = "Subscription plus top-up right after the deduction", example = "96")
        int balanceAfter,
        String sourceType,
        @Schema(description = "Reservation metadata as JSON text")
        String metadata,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}

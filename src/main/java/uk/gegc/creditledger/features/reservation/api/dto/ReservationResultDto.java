package uk.gegc.creditledger.features.reservation.api.dto;

import java.util.UUID;

public record ReservationResultDto(
        UUID reservationId,
        int balanceAfter
) {}

package uk.gegc.creditledger.features.reservation.application;

import uk.gegc.creditledger.features.reservation.api.dto.ReservationDto;
import uk.gegc.creditledger.features.reservation.api.dto.ReservationResultDto;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pay-then-finalize protocol for asynchronous paid work.
 * <p>
 * {@link #reserve} deducts immediately. {@link #capture} marks the work successful without touching
 * balances; {@link #release} refunds the full cost to the top-up pool. Only one of the two ever
 * takes effect for a reservation; later calls are no-ops.
 */
public interface ReservationService {

    /**
     * @throws uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException unchanged from the deduction
     */
    ReservationResultDto reserve(UUID userId, int cost, String sourceType, Map<String, Object> metadata);

    /**
     * @throws uk.gegc.creditledger.features.reservation.domain.exception.ReservationNotFoundException for unknown ids
     */
    void capture(UUID reservationId, Map<String, Object> metadata);

    /**
     * @throws uk.gegc.creditledger.features.reservation.domain.exception.ReservationNotFoundException for unknown ids
     */
    void release(UUID reservationId, String reason);

    ReservationDto getReservation(UUID reservationId);

    /**
     * Reservations still RESERVED that were created more than {@code age} ago, oldest first.
     * Read-only view for the external process that decides what to release.
     */
    List<ReservationDto> findOpenReservationsOlderThan(Duration age);
}

package uk.gegc.creditledger.features.reservation.domain.exception;

import java.util.UUID;

public class ReservationNotFoundException extends RuntimeException {

    private final UUID reservationId;

    public ReservationNotFoundException(UUID reservationId) {
        super("Reservation " + reservationId + " not found");
        this.reservationId = reservationId;
    }

    public UUID getReservationId() {
        return reservationId;
    }
}

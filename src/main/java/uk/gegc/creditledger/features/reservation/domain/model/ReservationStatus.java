package uk.gegc.creditledger.features.reservation.domain.model;

/**
 * RESERVED moves to exactly one of COMPLETED or CANCELLED; both are terminal.
 */
public enum ReservationStatus {
    RESERVED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RESERVED;
    }
}

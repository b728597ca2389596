package uk.gegc.creditledger.features.reservation.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Credits taken up front for work whose outcome is known later.
 * The deduction happens when the row is created; capture and release only finalize it.
 */
@Entity
@Table(name = "credit_reservations", indexes = {
        @Index(name = "idx_reservation_status_created", columnList = "status, created_at")
})
@Getter
@Setter
public class Reservation {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReservationStatus status;

    @Column(name = "cost", nullable = false, updatable = false)
    private int cost;

    /**
     * Subscription + top-up right after the deduction.
     */
    @Column(name = "balance_after", nullable = false, updatable = false)
    private int balanceAfter;

    @Column(name = "source_type", nullable = false, updatable = false, length = 64)
    private String sourceType;

    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

package uk.gegc.creditledger.features.reservation.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.reservation.domain.model.Reservation;
import uk.gegc.creditledger.features.reservation.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") UUID id);

    List<Reservation> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ReservationStatus status, LocalDateTime cutoff);

    List<Reservation> findByUserIdOrderByCreatedAtDesc(UUID userId);
}

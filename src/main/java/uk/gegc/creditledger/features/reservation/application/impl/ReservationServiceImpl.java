package uk.gegc.creditledger.features.reservation.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.reservation.api.dto.ReservationDto;
import uk.gegc.creditledger.features.reservation.api.dto.ReservationResultDto;
import uk.gegc.creditledger.features.reservation.application.ReservationService;
import uk.gegc.creditledger.features.reservation.domain.exception.ReservationNotFoundException;
import uk.gegc.creditledger.features.reservation.domain.model.Reservation;
import uk.gegc.creditledger.features.reservation.domain.model.ReservationStatus;
import uk.gegc.creditledger.features.reservation.infra.mapping.ReservationMapper;
import uk.gegc.creditledger.features.reservation.infra.repository.ReservationRepository;
import uk.gegc.creditledger.features.wallet.api.dto.DeductResultDto;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.application.LedgerStructuredLogger;
import uk.gegc.creditledger.features.wallet.application.WalletService;
import uk.gegc.creditledger.features.wallet.application.impl.LedgerMetadataCodec;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ReservationServiceImpl implements ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationServiceImpl.class);

    static final String SUBSCRIPTION_DEDUCTED = "subscriptionDeducted";
    static final String TOP_UP_DEDUCTED = "topUpDeducted";
    static final String GRACE_USED = "graceUsed";
    static final String CANCELLATION_REASON = "cancellationReason";

    private final ReservationRepository reservationRepository;
    private final WalletService walletService;
    private final LedgerMetadataCodec metadataCodec;
    private final ReservationMapper reservationMapper;
    private final CreditMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public ReservationResultDto reserve(UUID userId, int cost, String sourceType, Map<String, Object> metadata) {
        if (cost <= 0) {
            throw new InvalidAmountException("cost", cost);
        }

        UUID reservationId = UUID.randomUUID();
        DeductResultDto deduction = walletService.deductCredits(
                userId, cost, sourceType, reservationId.toString(), "Reservation for " + sourceType);

        Map<String, Object> stored = new LinkedHashMap<>();
        if (metadata != null) {
            stored.putAll(metadata);
        }
        stored.put(SUBSCRIPTION_DEDUCTED, deduction.subscriptionDeducted());
        stored.put(TOP_UP_DEDUCTED, deduction.topUpDeducted());
        stored.put(GRACE_USED, deduction.graceUsed());

        LocalDateTime now = LocalDateTime.now(clock);
        Reservation reservation = new Reservation();
        reservation.setId(reservationId);
        reservation.setUserId(userId);
        reservation.setStatus(ReservationStatus.RESERVED);
        reservation.setCost(cost);
        reservation.setBalanceAfter(deduction.balanceAfter());
        reservation.setSourceType(sourceType);
        reservation.setMetadata(metadataCodec.write(stored));
        reservation.setCreatedAt(now);
        reservation.setUpdatedAt(now);
        reservationRepository.save(reservation);

        LedgerStructuredLogger.logReservationOperation(log, "info",
                "Reserved {} credits for user {} as reservation {}",
                userId, "RESERVE", cost, reservationId.toString(), deduction.balanceAfter(),
                cost, userId, reservationId);
        metricsService.incrementReservationCreated();

        return new ReservationResultDto(reservationId, deduction.balanceAfter());
    }

    @Override
    @Transactional
    public void capture(UUID reservationId, Map<String, Object> metadata) {
        Reservation reservation = lock(reservationId);
        if (reservation.getStatus() != ReservationStatus.RESERVED) {
            log.info("Ignoring capture of reservation {} in status {}", reservationId, reservation.getStatus());
            return;
        }

        reservation.setStatus(ReservationStatus.COMPLETED);
        if (metadata != null && !metadata.isEmpty()) {
            reservation.setMetadata(metadataCodec.merge(reservation.getMetadata(), metadata));
        }
        reservation.setUpdatedAt(LocalDateTime.now(clock));
        reservationRepository.save(reservation);

        LedgerStructuredLogger.logReservationOperation(log, "info",
                "Captured reservation {} for user {}",
                reservation.getUserId(), "CAPTURE", reservation.getCost(), reservationId.toString(),
                reservation.getBalanceAfter(), reservationId, reservation.getUserId());
        metricsService.incrementReservationCaptured();
    }

    @Override
    @Transactional
    public void release(UUID reservationId, String reason) {
        Reservation reservation = lock(reservationId);
        if (reservation.getStatus() != ReservationStatus.RESERVED) {
            log.info("Ignoring release of reservation {} in status {}", reservationId, reservation.getStatus());
            return;
        }

        String refundReason = reason != null && !reason.isBlank()
                ? reason
                : "Reservation " + reservationId + " released";
        walletService.refundCredits(reservation.getUserId(), reservation.getCost(),
                originalPool(reservation), refundReason, reservationId.toString());

        Map<String, Object> cancellation = new LinkedHashMap<>();
        cancellation.put(CANCELLATION_REASON, reason);
        reservation.setStatus(ReservationStatus.CANCELLED);
        reservation.setMetadata(metadataCodec.merge(reservation.getMetadata(), cancellation));
        reservation.setUpdatedAt(LocalDateTime.now(clock));
        reservationRepository.save(reservation);

        LedgerStructuredLogger.logReservationOperation(log, "info",
                "Released reservation {} for user {}, refunded {} credits: {}",
                reservation.getUserId(), "RELEASE", reservation.getCost(), reservationId.toString(),
                reservation.getBalanceAfter(), reservationId, reservation.getUserId(), reservation.getCost(), refundReason);
        metricsService.incrementReservationReleased();
    }

    @Override
    @Transactional(readOnly = true)
    public ReservationDto getReservation(UUID reservationId) {
        return reservationRepository.findById(reservationId)
                .map(reservationMapper::toDto)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReservationDto> findOpenReservationsOlderThan(Duration age) {
        Objects.requireNonNull(age, "age must not be null");
        if (age.isNegative()) {
            throw new IllegalArgumentException("age must not be negative");
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(age);
        return reservationMapper.toDtos(
                reservationRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ReservationStatus.RESERVED, cutoff));
    }

    private Reservation lock(UUID reservationId) {
        Objects.requireNonNull(reservationId, "reservationId must not be null");
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    /**
     * First pool the reservation drew from. Refunds always land in top-up; this is only recorded.
     */
    private WalletPool originalPool(Reservation reservation) {
        Object subscriptionDeducted = metadataCodec.read(reservation.getMetadata()).get(SUBSCRIPTION_DEDUCTED);
        return subscriptionDeducted instanceof Number n && n.intValue() > 0
                ? WalletPool.SUBSCRIPTION
                : WalletPool.TOPUP;
    }
}

package uk.gegc.creditledger.features.reservation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.reservation.api.dto.ReservationDto;
import uk.gegc.creditledger.features.reservation.application.ReservationService;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/credits/reservations")
@RequiredArgsConstructor
@Validated
@Tag(name = "Credit Reservations", description = "Read-only reservation state for reconciliation")
@SecurityRequirement(name = "basicAuth")
public class ReservationController {

    private final ReservationService reservationService;

    @Operation(summary = "List stale reservations",
            description = "Reservations still RESERVED after the given age, oldest first. Requires CREDITS_READ.")
    @GetMapping("/stale")
    @PreAuthorize("hasAuthority('CREDITS_READ')")
    public ResponseEntity<List<ReservationDto>> findStale(
            @Parameter(description = "Minimum age in minutes")
            @RequestParam(name = "olderThanMinutes", defaultValue = "60") @Min(0) long olderThanMinutes) {
        return ResponseEntity.ok(reservationService.findOpenReservationsOlderThan(Duration.ofMinutes(olderThanMinutes)));
    }

    @Operation(summary = "Get a reservation", description = "Requires CREDITS_READ.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reservation"),
            @ApiResponse(responseCode = "404", description = "Unknown reservation id")
    })
    @GetMapping("/{reservationId}")
    @PreAuthorize("hasAuthority('CREDITS_READ')")
    public ResponseEntity<ReservationDto> getReservation(@PathVariable UUID reservationId) {
        return ResponseEntity.ok(reservationService.getReservation(reservationId));
    }
}

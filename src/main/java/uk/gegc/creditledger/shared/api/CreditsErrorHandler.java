package uk.gegc.creditledger.shared.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import uk.gegc.creditledger.features.reservation.domain.exception.ReservationNotFoundException;
import uk.gegc.creditledger.features.subscription.domain.exception.BillingPeriodAlreadyAppliedException;
import uk.gegc.creditledger.features.subscription.domain.exception.SubscriptionCreditsAlreadyGrantedException;
import uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.shared.api.problem.ErrorTypes;
import uk.gegc.creditledger.shared.api.problem.ProblemDetailBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps credit ledger exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.creditledger.features")
public class CreditsErrorHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientCredits(InsufficientCreditsException ex, HttpServletRequest request) {
        log.warn("Insufficient credits: {}", ex.getMessage());
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("required", ex.getRequired());
        properties.put("available", ex.getAvailable());
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.CONFLICT,
                ErrorTypes.INSUFFICIENT_CREDITS,
                "Insufficient Credits",
                ex.getMessage(),
                request,
                properties
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<ProblemDetail> handleInvalidAmount(InvalidAmountException ex, HttpServletRequest request) {
        log.warn("Invalid amount: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_AMOUNT,
                "Invalid Amount",
                ex.getMessage(),
                request
        );
        problem.setProperty("field", ex.getField());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ReservationNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleReservationNotFound(ReservationNotFoundException ex, HttpServletRequest request) {
        log.warn("Reservation not found: {}", ex.getReservationId());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.RESERVATION_NOT_FOUND,
                "Reservation Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(SubscriptionCreditsAlreadyGrantedException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyGranted(SubscriptionCreditsAlreadyGrantedException ex, HttpServletRequest request) {
        log.warn("Subscription credits already granted: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.SUBSCRIPTION_ALREADY_GRANTED,
                "Subscription Credits Already Granted",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(BillingPeriodAlreadyAppliedException.class)
    public ResponseEntity<ProblemDetail> handlePeriodApplied(BillingPeriodAlreadyAppliedException ex, HttpServletRequest request) {
        log.info("Billing period already applied: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.BILLING_PERIOD_ALREADY_APPLIED,
                "Billing Period Already Applied",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String detail = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                detail,
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ProblemDetail> handleConstraintViolation(Exception ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                "Invalid Argument",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                "Access Denied",
                "You do not have permission to access this resource",
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error in credits API", ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}

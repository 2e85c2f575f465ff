package com.byootify.booking_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the booking error taxonomy onto HTTP responses.
 *
 * Client-facing errors (conflict, expired reservation, declined payment) are returned
 * immediately. Invariant violations are logged at ERROR for alerting.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.info("Booking conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Slot Unavailable", e.getMessage(), Map.of(
                "requested_start", e.getRequested().getStart().toString(),
                "requested_end", e.getRequested().getEnd().toString()));
    }

    @ExceptionHandler(OutsideWorkingHoursException.class)
    public ResponseEntity<ErrorResponse> handleOutsideWorkingHours(OutsideWorkingHoursException e) {
        log.info("Outside working hours: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Outside Working Hours", e.getMessage(), Map.of(
                "requested_start", e.getRequested().getStart().toString(),
                "requested_end", e.getRequested().getEnd().toString()));
    }

    @ExceptionHandler(ReservationExpiredException.class)
    public ResponseEntity<ErrorResponse> handleExpired(ReservationExpiredException e) {
        log.info("Reservation expired: {}", e.getMessage());
        return respond(HttpStatus.GONE, "Reservation Expired", e.getMessage(), null);
    }

    @ExceptionHandler(PaymentDeclinedException.class)
    public ResponseEntity<ErrorResponse> handleDeclined(PaymentDeclinedException e) {
        log.info("Payment declined: {}", e.getMessage());
        return respond(HttpStatus.PAYMENT_REQUIRED, "Payment Declined", e.getMessage(), null);
    }

    @ExceptionHandler(AppointmentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AppointmentNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler({LedgerWriteException.class, ProcessorUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        log.error("Dependency unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "A downstream dependency is unavailable, retry later", null);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        log.error("INVARIANT VIOLATION: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}

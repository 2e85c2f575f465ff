package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.booking.dto.AppointmentResponse;
import com.byootify.booking_ledger.booking.dto.CancelAppointmentRequest;
import com.byootify.booking_ledger.booking.dto.CompleteAppointmentRequest;
import com.byootify.booking_ledger.booking.dto.CreateAppointmentRequest;
import com.byootify.booking_ledger.booking.dto.NoShowRequest;
import com.byootify.booking_ledger.booking.dto.TipRequest;
import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API for appointments.
 *
 * Creation requires an Idempotency-Key header; a retried request returns the original
 * appointment with 200 instead of 201. Lifecycle endpoints are idempotent per
 * {@code trigger_event_id}.
 */
@RestController
@RequestMapping("/api/appointments")
@RequiredArgsConstructor
@Slf4j
public class AppointmentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<AppointmentResponse> createAppointment(
            @Valid @RequestBody CreateAppointmentRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received booking request: providerId={}, start={}, end={}, price={} {}",
                request.getProviderId(), request.getStart(), request.getEnd(),
                request.getServicePriceMinor(), request.getCurrency());

        BookingRequest booking = new BookingRequest(
            request.getClientId(),
            request.getProviderId(),
            TimeInterval.of(request.getStart(), request.getEnd()),
            request.getServicePriceMinor(),
            parseCurrency(request.getCurrency()),
            request.getPaymentMethod()
        );

        AppointmentDetails details = bookingService.request(booking, idempotencyKey);
        HttpStatus status = details.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(AppointmentResponse.from(details));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentResponse> getAppointment(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AppointmentResponse.from(bookingService.getAppointment(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<AppointmentResponse> cancel(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody CancelAppointmentRequest request) {
        return ResponseEntity.ok(AppointmentResponse.from(
            bookingService.cancel(id, request.getTriggerEventId(), request.getCancelledBy())));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<AppointmentResponse> complete(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody CompleteAppointmentRequest request) {
        return ResponseEntity.ok(AppointmentResponse.from(
            bookingService.complete(id, request.getTriggerEventId(), request.tipOrZero())));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<AppointmentResponse> markNoShow(@PathVariable("id") UUID id,
                                                          @Valid @RequestBody NoShowRequest request) {
        return ResponseEntity.ok(AppointmentResponse.from(
            bookingService.markNoShow(id, request.getTriggerEventId())));
    }

    @PostMapping("/{id}/tips")
    public ResponseEntity<AppointmentResponse> addTip(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody TipRequest request) {
        return ResponseEntity.ok(AppointmentResponse.from(
            bookingService.addTip(id, request.getTriggerEventId(), request.getAmountMinor())));
    }

    private static CurrencyCode parseCurrency(String currency) {
        try {
            return CurrencyCode.valueOf(currency);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + currency);
        }
    }
}

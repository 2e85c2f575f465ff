package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.byootify.booking_ledger.fee.FeeSchedule;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Appointment domain object.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected with {@link IllegalStateException}
 * - State changes are immutable (each transition returns a new Appointment)
 */
@Value
@With(lombok.AccessLevel.PRIVATE)
public class Appointment {
    UUID id;
    UUID clientId;
    UUID providerId;
    long servicePrice;         // minor units
    CurrencyCode currency;
    TimeInterval interval;
    AppointmentStatus status;
    String paymentMethod;
    String holdToken;          // null until the hold is captured
    long holdAmount;
    FeeSchedule feeSchedule;   // snapshot taken at confirmation
    CancellationParty cancelledBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new appointment in REQUESTED status.
     */
    public static Appointment request(UUID id, UUID clientId, UUID providerId, long servicePrice,
                                      CurrencyCode currency, TimeInterval interval, String paymentMethod,
                                      Instant now) {
        if (servicePrice <= 0) {
            throw new IllegalArgumentException("Service price must be positive");
        }
        return new Appointment(id, clientId, providerId, servicePrice, currency, interval,
                AppointmentStatus.REQUESTED, paymentMethod, null, 0, null, null, now, now);
    }

    /**
     * Transitions to CONFIRMED once the interval is committed and the hold captured.
     */
    public Appointment confirm(String holdToken, long holdAmount, FeeSchedule feeSchedule, Instant now) {
        requireStatus(AppointmentStatus.REQUESTED, "confirm");
        return new Appointment(id, clientId, providerId, servicePrice, currency, interval,
                AppointmentStatus.CONFIRMED, paymentMethod, holdToken, holdAmount, feeSchedule, null,
                createdAt, now);
    }

    public Appointment complete(Instant now) {
        requireStatus(AppointmentStatus.CONFIRMED, "complete");
        if (now.isBefore(interval.getStart())) {
            throw new IllegalStateException(
                String.format("Cannot complete appointment %s before it starts at %s", id, interval.getStart()));
        }
        return withStatus(AppointmentStatus.COMPLETED).withUpdatedAt(now);
    }

    public Appointment cancel(CancellationParty party, Instant now) {
        requireStatus(AppointmentStatus.CONFIRMED, "cancel");
        return withStatus(AppointmentStatus.CANCELLED).withCancelledBy(party).withUpdatedAt(now);
    }

    /**
     * A no-show can only be recorded once the appointment window has ended.
     */
    public Appointment markNoShow(Instant now) {
        requireStatus(AppointmentStatus.CONFIRMED, "mark as no-show");
        if (now.isBefore(interval.getEnd())) {
            throw new IllegalStateException(
                String.format("Cannot mark appointment %s as no-show before it ends at %s", id, interval.getEnd()));
        }
        return withStatus(AppointmentStatus.NO_SHOW).withUpdatedAt(now);
    }

    /**
     * Whether a cancellation at {@code now} falls inside the short-notice window before the start.
     */
    public boolean isShortNotice(Instant now, Duration window) {
        return !now.isBefore(interval.getStart().minus(window));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireStatus(AppointmentStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s appointment %s in %s status. Appointment must be %s.",
                    action, id, status, expected));
        }
    }
}

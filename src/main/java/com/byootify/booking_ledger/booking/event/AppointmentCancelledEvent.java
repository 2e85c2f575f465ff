package com.byootify.booking_ledger.booking.event;

import com.byootify.booking_ledger.booking.Appointment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a confirmed appointment is cancelled. {@code shortNotice} tells the
 * client whether a cancellation fee was withheld from the refund.
 */
@Value
public class AppointmentCancelledEvent implements AppointmentEvent {
    UUID eventId;
    UUID appointmentId;
    UUID clientId;
    UUID providerId;
    String cancelledBy;
    boolean shortNotice;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AppointmentCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AppointmentCancelledEvent from(Appointment appointment, boolean shortNotice, Instant occurredAt) {
        return new AppointmentCancelledEvent(
            UUID.randomUUID(),
            appointment.getId(),
            appointment.getClientId(),
            appointment.getProviderId(),
            appointment.getCancelledBy().name(),
            shortNotice,
            occurredAt
        );
    }
}

package com.byootify.booking_ledger.booking.event;

import com.byootify.booking_ledger.booking.Appointment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for both COMPLETED and NO_SHOW outcomes; {@code status} tells them apart.
 */
@Value
public class AppointmentCompletedEvent implements AppointmentEvent {
    UUID eventId;
    UUID appointmentId;
    UUID clientId;
    UUID providerId;
    String status;
    long tipAmount;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AppointmentCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AppointmentCompletedEvent from(Appointment appointment, long tipAmount, Instant occurredAt) {
        return new AppointmentCompletedEvent(
            UUID.randomUUID(),
            appointment.getId(),
            appointment.getClientId(),
            appointment.getProviderId(),
            appointment.getStatus().name(),
            tipAmount,
            appointment.getCurrency().name(),
            occurredAt
        );
    }
}

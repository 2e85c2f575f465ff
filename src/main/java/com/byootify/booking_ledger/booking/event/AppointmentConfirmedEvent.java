package com.byootify.booking_ledger.booking.event;

import com.byootify.booking_ledger.booking.Appointment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AppointmentConfirmedEvent implements AppointmentEvent {
    UUID eventId;
    UUID appointmentId;
    UUID clientId;
    UUID providerId;
    Instant start;
    Instant end;
    long servicePrice;
    long holdAmount;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AppointmentConfirmed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AppointmentConfirmedEvent from(Appointment appointment, Instant occurredAt) {
        return new AppointmentConfirmedEvent(
            UUID.randomUUID(),
            appointment.getId(),
            appointment.getClientId(),
            appointment.getProviderId(),
            appointment.getInterval().getStart(),
            appointment.getInterval().getEnd(),
            appointment.getServicePrice(),
            appointment.getHoldAmount(),
            appointment.getCurrency().name(),
            occurredAt
        );
    }
}

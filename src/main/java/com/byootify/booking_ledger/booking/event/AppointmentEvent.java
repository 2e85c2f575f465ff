package com.byootify.booking_ledger.booking.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification facts about an appointment, written to the outbox in the same transaction
 * as the state change.
 */
public interface AppointmentEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getAppointmentId();

    Instant getOccurredAt();

    String getEventType();
}

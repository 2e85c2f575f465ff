package com.byootify.booking_ledger.calendar;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Handle to a tentative hold returned by {@link CalendarService#tryReserve}.
 */
@Value
public class Reservation {
    UUID providerId;
    UUID appointmentId;
    TimeInterval interval;
    Instant expiresAt;
}

package com.byootify.booking_ledger.calendar;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An interval committed to a provider's calendar on behalf of one appointment.
 */
@Value
public class BookedInterval {
    UUID providerId;
    UUID appointmentId;
    TimeInterval interval;
    IntervalStatus status;
    Instant expiresAt;   // null once confirmed

    /**
     * A tentative hold is live until its expiry; confirmed intervals never lapse.
     */
    public boolean isLive(Instant now) {
        return status == IntervalStatus.CONFIRMED || (expiresAt != null && expiresAt.isAfter(now));
    }
}

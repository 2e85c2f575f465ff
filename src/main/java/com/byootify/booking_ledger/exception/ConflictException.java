package com.byootify.booking_ledger.exception;

import com.byootify.booking_ledger.calendar.TimeInterval;
import lombok.Getter;

/**
 * The requested window overlaps a booking or live hold on the provider's calendar.
 *
 * Carries only the requested window; the conflicting appointment is never exposed.
 */
@Getter
public class ConflictException extends RuntimeException {

    private final TimeInterval requested;

    public ConflictException(TimeInterval requested) {
        super(String.format("Requested window %s is not available", requested));
        this.requested = requested;
    }
}

package com.byootify.booking_ledger.exception;

import com.byootify.booking_ledger.calendar.TimeInterval;
import lombok.Getter;

import java.util.UUID;

/**
 * The provider publishes working hours and the requested window is not inside any of them.
 */
@Getter
public class OutsideWorkingHoursException extends RuntimeException {

    private final TimeInterval requested;

    public OutsideWorkingHoursException(UUID providerId, TimeInterval requested) {
        super(String.format("Requested window %s is outside the working hours of provider %s", requested, providerId));
        this.requested = requested;
    }
}

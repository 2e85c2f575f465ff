package com.byootify.booking_ledger.booking;

/**
 * Appointment lifecycle states.
 *
 * REQUESTED -> CONFIRMED -> COMPLETED | CANCELLED | NO_SHOW
 */
public enum AppointmentStatus {
    REQUESTED,
    CONFIRMED,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
    }
}

package com.byootify.booking_ledger.exception;

import java.util.UUID;

/**
 * A tentative hold lapsed (or was swept) before it could be confirmed.
 * The client has to start the booking again.
 */
public class ReservationExpiredException extends RuntimeException {

    public ReservationExpiredException(UUID appointmentId) {
        super("Reservation for appointment " + appointmentId + " has expired");
    }
}

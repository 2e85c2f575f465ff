package com.byootify.booking_ledger.booking;

import lombok.Value;

/**
 * Result of applying a transition. {@code transition} is null when nothing was applied.
 */
@Value
public class TransitionOutcome {
    Appointment appointment;
    AppointmentTransition transition;
    boolean applied;

    public static TransitionOutcome applied(Appointment appointment, AppointmentTransition transition) {
        return new TransitionOutcome(appointment, transition, true);
    }

    public static TransitionOutcome unchanged(Appointment appointment) {
        return new TransitionOutcome(appointment, null, false);
    }
}

package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.fee.CancellationParty;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of an appointment's state history, keyed by the event that triggered it.
 */
@Value
public class AppointmentTransition {
    UUID id;
    UUID appointmentId;
    TransitionType type;
    AppointmentStatus fromStatus;
    AppointmentStatus toStatus;
    String triggerEventId;
    CancellationParty cancelledBy;
    boolean shortNotice;
    long tipAmount;
    Instant occurredAt;
    LedgerStatus ledgerStatus;
    int ledgerAttempts;
    String lastError;
}

package com.byootify.booking_ledger.booking;

import lombok.Value;

import java.util.List;

/**
 * An appointment with its state history, as returned to API callers.
 */
@Value
public class AppointmentDetails {
    Appointment appointment;
    List<AppointmentTransition> history;
    boolean replayed;

    /**
     * Ledger status of the latest transition; PENDING when there is none.
     */
    public LedgerStatus latestLedgerStatus() {
        return history.isEmpty() ? LedgerStatus.PENDING : history.get(history.size() - 1).getLedgerStatus();
    }
}

package com.byootify.booking_ledger.fee;

/**
 * Who cancelled an appointment. Only client cancellations can carry a fee.
 */
public enum CancellationParty {
    CLIENT,
    PROVIDER
}

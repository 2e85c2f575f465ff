package com.byootify.booking_ledger.booking;

/**
 * Whether the ledger entries of a transition have been recorded.
 *
 * DEGRADED postings are retried in the background; HALTED ones hit an invariant violation
 * and wait for an operator.
 */
public enum LedgerStatus {
    PENDING,
    RECORDED,
    DEGRADED,
    HALTED
}

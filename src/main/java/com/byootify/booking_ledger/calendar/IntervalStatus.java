package com.byootify.booking_ledger.calendar;

/**
 * Lifecycle of a calendar interval.
 *
 * TENTATIVE rows expire on their own; CONFIRMED rows live until released.
 */
public enum IntervalStatus {
    TENTATIVE,
    CONFIRMED
}

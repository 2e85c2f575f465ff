package com.byootify.booking_ledger.ledger;

/**
 * Parties money moves between. Every entry moves its amount from one account to another,
 * so the signed deltas of any set of entries sum to zero.
 */
public enum LedgerAccount {
    /** The paying client's card or wallet. */
    CLIENT,
    /** Reservation holds the platform keeps until the appointment resolves. */
    ESCROW,
    /** Provider earnings awaiting payout. */
    PROVIDER,
    /** Platform revenue. */
    PLATFORM,
    /** Provider's external bank account. */
    PROVIDER_BANK
}

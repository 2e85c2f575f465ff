package com.byootify.booking_ledger.ledger;

/**
 * Ledger entry kinds.
 *
 * Singular kinds occur at most once per appointment, backed by a partial unique index.
 */
public enum EntryKind {
    RESERVATION_HOLD(true),
    SERVICE_FEE(true),
    SERVICE_CHARGE(true),
    COMMISSION(true),
    CANCELLATION_FEE(true),
    HOLD_TOP_UP(true),
    TIP(false),
    REFUND(false),
    PAYOUT(false),
    PAYOUT_REVERSAL(false);

    private final boolean singular;

    EntryKind(boolean singular) {
        this.singular = singular;
    }

    public boolean isSingular() {
        return singular;
    }
}

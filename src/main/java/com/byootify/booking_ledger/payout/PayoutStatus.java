package com.byootify.booking_ledger.payout;

public enum PayoutStatus {
    PENDING,
    SETTLED,
    REVERSED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

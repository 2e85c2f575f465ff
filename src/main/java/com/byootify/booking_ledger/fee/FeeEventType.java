package com.byootify.booking_ledger.fee;

public enum FeeEventType {
    CONFIRMED,
    COMPLETED,
    CANCELLED,
    NO_SHOW,
    TIP
}

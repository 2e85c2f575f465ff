package com.byootify.booking_ledger.settlement;

public enum SettlementStatus {
    PENDING,
    SENT,
    FAILED
}

package com.byootify.booking_ledger.payout;

public enum PayoutFrequency {
    DAILY,
    WEEKLY,
    MONTHLY
}

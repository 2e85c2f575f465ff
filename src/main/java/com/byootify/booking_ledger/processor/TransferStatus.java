package com.byootify.booking_ledger.processor;

import java.util.Locale;

public enum TransferStatus {
    PENDING,
    SETTLED,
    FAILED;

    /**
     * Maps a processor-reported status onto the three states the payout cycle acts on.
     * Anything not terminal (processing, in_transit, unknown values) stays PENDING.
     */
    public static TransferStatus fromProcessor(String status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "settled", "paid", "succeeded" -> SETTLED;
            case "failed", "canceled", "cancelled", "reversed", "returned" -> FAILED;
            default -> PENDING;
        };
    }
}

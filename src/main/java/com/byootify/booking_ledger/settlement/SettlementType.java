package com.byootify.booking_ledger.settlement;

public enum SettlementType {
    /** Return funds to the client against the captured hold. */
    REFUND,
    /** Charge the client's payment method. */
    CHARGE
}

package com.byootify.booking_ledger.ledger;

/**
 * ISO-4217 currencies accepted for bookings. Amounts are always carried in the
 * currency's minor unit (cents).
 */
public enum CurrencyCode {
    USD,
    CAD,
    EUR,
    GBP
}

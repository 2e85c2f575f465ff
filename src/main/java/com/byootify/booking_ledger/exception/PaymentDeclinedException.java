package com.byootify.booking_ledger.exception;

/**
 * The payment processor refused to capture the reservation hold.
 * Terminal for this attempt; never retried behind the client's back.
 */
public class PaymentDeclinedException extends RuntimeException {

    public PaymentDeclinedException(String reason) {
        super("Payment declined: " + reason);
    }
}

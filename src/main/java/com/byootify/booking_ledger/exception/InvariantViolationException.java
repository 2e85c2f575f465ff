package com.byootify.booking_ledger.exception;

/**
 * A money or calendar invariant does not hold. Indicates a bug: processing of the
 * affected appointment stops and nothing is corrected automatically.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}

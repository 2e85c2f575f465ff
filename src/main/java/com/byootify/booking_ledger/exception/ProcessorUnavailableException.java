package com.byootify.booking_ledger.exception;

/**
 * Transient payment processor failure (timeout, 5xx, connection refused).
 * Safe to retry with the same idempotency key.
 */
public class ProcessorUnavailableException extends RuntimeException {

    public ProcessorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

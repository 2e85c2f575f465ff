package com.byootify.booking_ledger.exception;

/**
 * Infrastructure failure while recording ledger entries.
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

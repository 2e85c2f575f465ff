package com.byootify.booking_ledger.exception;

/**
 * The processor definitively refused a payout transfer (closed account, compliance hold).
 */
public class TransferRejectedException extends RuntimeException {

    public TransferRejectedException(String reason) {
        super("Transfer rejected: " + reason);
    }
}

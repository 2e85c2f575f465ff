package com.byootify.booking_ledger.processor;

import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.exception.ProcessorUnavailableException;
import com.byootify.booking_ledger.exception.TransferRejectedException;
import com.byootify.booking_ledger.ledger.CurrencyCode;

/**
 * Narrow interface to the external payment processor.
 *
 * Every call carries an idempotency key; repeating a call with the same key must not move
 * money twice. Callers never invoke these methods while holding a database lock.
 */
public interface PaymentProcessorClient {

    /**
     * Captures the reservation hold from the client's payment method.
     *
     * @return processor token identifying the captured hold
     * @throws PaymentDeclinedException if the processor refuses the capture
     * @throws ProcessorUnavailableException on timeout or transport failure
     */
    String captureHold(long amount, CurrencyCode currency, String paymentMethod, String idempotencyKey);

    /**
     * Returns part or all of a captured hold to the client.
     *
     * @return processor reference of the refund
     */
    String refund(String holdToken, long amount, CurrencyCode currency, String idempotencyKey);

    /**
     * Charges the client's payment method (service fee, balance of the price, tips).
     *
     * @return processor reference of the charge
     */
    String charge(String paymentMethod, long amount, CurrencyCode currency, String idempotencyKey);

    /**
     * Starts a payout transfer to the provider's bank account.
     *
     * @return transfer id for later status queries
     * @throws TransferRejectedException if the processor definitively refuses the transfer
     * @throws ProcessorUnavailableException on timeout or transport failure
     */
    String transfer(String providerAccount, long amount, CurrencyCode currency, String idempotencyKey);

    TransferStatus transferStatus(String transferId);
}

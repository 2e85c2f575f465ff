package com.byootify.booking_ledger.processor;

import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory processor for local runs and tests.
 *
 * Payment methods starting with {@code decline} are refused; every other call succeeds and
 * transfers settle on their first status query. Results are remembered per idempotency key.
 */
@Component
@ConditionalOnProperty(name = "payment-processor.mode", havingValue = "sandbox", matchIfMissing = true)
@Slf4j
public class SandboxPaymentProcessorClient implements PaymentProcessorClient {

    private static final String DECLINE_PREFIX = "decline";

    private final Map<String, String> resultsByKey = new ConcurrentHashMap<>();
    private final Map<String, TransferStatus> transfers = new ConcurrentHashMap<>();

    @Override
    public String captureHold(long amount, CurrencyCode currency, String paymentMethod, String idempotencyKey) {
        if (paymentMethod == null || paymentMethod.startsWith(DECLINE_PREFIX)) {
            throw new PaymentDeclinedException("card declined by issuer");
        }
        return resultsByKey.computeIfAbsent(idempotencyKey, key -> {
            log.debug("Sandbox hold captured: amount={}, currency={}", amount, currency);
            return "hold_" + UUID.randomUUID();
        });
    }

    @Override
    public String refund(String holdToken, long amount, CurrencyCode currency, String idempotencyKey) {
        return resultsByKey.computeIfAbsent(idempotencyKey, key -> {
            log.debug("Sandbox refund: holdToken={}, amount={}, currency={}", holdToken, amount, currency);
            return "refund_" + UUID.randomUUID();
        });
    }

    @Override
    public String charge(String paymentMethod, long amount, CurrencyCode currency, String idempotencyKey) {
        return resultsByKey.computeIfAbsent(idempotencyKey, key -> {
            log.debug("Sandbox charge: amount={}, currency={}", amount, currency);
            return "charge_" + UUID.randomUUID();
        });
    }

    @Override
    public String transfer(String providerAccount, long amount, CurrencyCode currency, String idempotencyKey) {
        return resultsByKey.computeIfAbsent(idempotencyKey, key -> {
            String transferId = "tr_" + UUID.randomUUID();
            transfers.put(transferId, TransferStatus.PENDING);
            log.debug("Sandbox transfer started: transferId={}, amount={}, currency={}", transferId, amount, currency);
            return transferId;
        });
    }

    @Override
    public TransferStatus transferStatus(String transferId) {
        TransferStatus status = transfers.get(transferId);
        if (status == null) {
            return TransferStatus.FAILED;
        }
        if (status == TransferStatus.PENDING) {
            transfers.put(transferId, TransferStatus.SETTLED);
            return TransferStatus.SETTLED;
        }
        return status;
    }
}

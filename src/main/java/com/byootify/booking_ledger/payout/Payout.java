package com.byootify.booking_ledger.payout;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A transfer of a provider's swept balance to their bank account.
 *
 * The matching PAYOUT ledger entry is written in the same transaction as the PENDING row; a
 * failed transfer is offset by a PAYOUT_REVERSAL entry so the funds are swept again.
 */
@Value
public class Payout {
    UUID id;
    UUID providerId;
    long amount;
    CurrencyCode currency;
    Instant cutoff;
    PayoutStatus status;
    String transferId;        // null until the processor accepted the transfer
    int attempts;
    String lastError;
    String idempotencyKey;
    Instant createdAt;
    Instant updatedAt;
}

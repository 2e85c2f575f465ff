package com.byootify.booking_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A recorded ledger entry. Immutable once written; corrections are new offsetting entries.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID appointmentId;    // null for payout entries
    UUID providerId;
    UUID clientId;         // null for payout entries
    UUID payoutId;         // null for appointment entries
    EntryKind kind;
    LedgerAccount fromAccount;
    LedgerAccount toAccount;
    long amount;
    CurrencyCode currency;
    String triggerEventId;
    Instant effectiveAt;
    Instant createdAt;
    String idempotencyKey;
    Long sequenceNumber;

    public long deltaFor(LedgerAccount account) {
        long delta = 0;
        if (toAccount == account) {
            delta += amount;
        }
        if (fromAccount == account) {
            delta -= amount;
        }
        return delta;
    }
}

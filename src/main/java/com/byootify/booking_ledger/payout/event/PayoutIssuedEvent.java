package com.byootify.booking_ledger.payout.event;

import com.byootify.booking_ledger.payout.Payout;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once the processor reports the payout transfer as settled.
 */
@Value
public class PayoutIssuedEvent {
    UUID eventId;
    UUID payoutId;
    UUID providerId;
    long amount;
    String currency;
    Instant cutoff;
    String transferId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutIssued";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutIssuedEvent from(Payout payout, Instant occurredAt) {
        return new PayoutIssuedEvent(
            UUID.randomUUID(),
            payout.getId(),
            payout.getProviderId(),
            payout.getAmount(),
            payout.getCurrency().name(),
            payout.getCutoff(),
            payout.getTransferId(),
            occurredAt
        );
    }
}

package com.byootify.booking_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification fact waiting in the transactional outbox.
 *
 * Written in the same transaction as the state change it describes and published to Kafka
 * by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Appointment" or "Payout"
    UUID aggregateId;
    String eventType;          // e.g. "AppointmentConfirmed"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

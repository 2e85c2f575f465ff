package com.byootify.booking_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an upstream event handled (or deliberately skipped) by a consumer group.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateId;       // appointment id or processor transfer id
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,    // not relevant to this consumer
        REJECTED    // business rule refused it; redelivery would not help
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateId,
                                         String consumerGroup, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, now,
                ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateId,
                                         String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, now,
                ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent rejected(UUID eventId, String eventType, String aggregateId,
                                          String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, now,
                ProcessingResult.REJECTED, reason);
    }
}

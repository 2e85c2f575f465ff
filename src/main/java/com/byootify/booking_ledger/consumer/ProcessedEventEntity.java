package com.byootify.booking_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "processed_events",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_processed_events_group", columnNames = {"event_id", "consumer_group"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "aggregate_id", length = 100, updatable = false)
    private String aggregateId;

    @Column(name = "consumer_group", nullable = false, length = 100, updatable = false)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, length = 20, updatable = false)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    public static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        return new ProcessedEventEntity(
            UUID.randomUUID(),
            event.getEventId(),
            event.getEventType(),
            event.getAggregateId(),
            event.getConsumerGroup(),
            event.getProcessedAt(),
            event.getResult(),
            event.getErrorMessage()
        );
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, aggregateId, consumerGroup, processedAt,
                processingResult, errorMessage);
    }
}

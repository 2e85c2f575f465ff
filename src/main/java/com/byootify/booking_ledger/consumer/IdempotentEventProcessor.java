package com.byootify.booking_ledger.consumer;

import com.byootify.booking_ledger.exception.AppointmentNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs each upstream event at most once per consumer group.
 *
 * The handler is not wrapped in a transaction of its own: booking transitions commit before
 * their ledger posting, and that ordering must hold for events too. Handlers are idempotent on
 * the event id (it becomes the transition's trigger id), so a crash between the handler and the
 * processed_events insert only costs a harmless replay.
 *
 * Outcomes:
 * - success: recorded, returns true
 * - business rejection (invalid state, unknown appointment): recorded as REJECTED, returns false
 * - anything else: nothing recorded, rethrown so Kafka redelivers
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    public boolean processEvent(UUID eventId, String eventType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (IllegalStateException | IllegalArgumentException | AppointmentNotFoundException e) {
            log.warn("Event {} ({}) rejected by consumer group {}: {}", eventId, eventType, consumerGroup, e.getMessage());
            record(ProcessedEvent.rejected(eventId, eventType, aggregateId, consumerGroup, e.getMessage(), clock.instant()));
            return false;
        }

        record(ProcessedEvent.success(eventId, eventType, aggregateId, consumerGroup, clock.instant()));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    public void skipEvent(UUID eventId, String eventType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventId, eventType, aggregateId, consumerGroup, reason, clock.instant()));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        try {
            repository.save(ProcessedEventEntity.fromDomain(event));
        } catch (DataIntegrityViolationException e) {
            log.info("Event {} was recorded concurrently by consumer group {}", event.getEventId(), event.getConsumerGroup());
        }
    }
}

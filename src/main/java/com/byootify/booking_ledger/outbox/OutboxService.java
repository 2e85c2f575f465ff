package com.byootify.booking_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes notification events to the outbox inside business transactions.
 *
 * If the business operation commits, the event is guaranteed to be written; if it rolls
 * back, so does the event. Publishing happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String APPOINTMENT_AGGREGATE = "Appointment";
    public static final String PAYOUT_AGGREGATE = "Payout";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the caller's transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

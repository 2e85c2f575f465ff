package com.byootify.booking_ledger.outbox;

import com.byootify.booking_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher moving outbox events to the notifications topic.
 *
 * - Aggregate id is the Kafka key, so events of one appointment stay ordered
 * - Sends synchronously and marks published only after the broker acknowledges
 * - Failed sends bump the retry count; events out of retries stay in the table as dead letters
 *
 * Notifications are best effort: publishing never blocks a booking.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${booking.topic.notifications:booking-notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(notificationsTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} exhausted {} retries and is dead-lettered. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}

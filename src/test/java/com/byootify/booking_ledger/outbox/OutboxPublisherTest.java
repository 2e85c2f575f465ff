package com.byootify.booking_ledger.outbox;

import com.byootify.booking_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OutboxPublisherTest {

    private static final String TOPIC = "booking-notifications";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "notificationsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.APPOINTMENT_AGGREGATE, UUID.randomUUID(),
                "AppointmentConfirmed", "{\"eventType\":\"AppointmentConfirmed\"}", Instant.now(), null,
                retryCount, null, 1L);
    }

    @SuppressWarnings("unchecked")
    private static SendResult<String, String> acknowledged() {
        SendResult<String, String> result = mock(SendResult.class);
        when(result.getRecordMetadata()).thenReturn(new RecordMetadata(new TopicPartition(TOPIC, 0), 7L, 0, 0L, 0, 0));
        return result;
    }

    @Test
    @DisplayName("Acknowledged sends are keyed by aggregate id and marked published")
    void publishesAndMarks() {
        OutboxEvent event = event(0);
        SendResult<String, String> result = acknowledged();
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(result));

        publisher.triggerPublish();

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublished("AppointmentConfirmed");
    }

    @Test
    @DisplayName("A failed send bumps the retry count and leaves the event unpublished")
    void failedSendMarksFailed() {
        OutboxEvent event = event(0);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unreachable")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("AppointmentConfirmed");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void lastRetryDeadLetters() {
        OutboxEvent event = event(2);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unreachable")));

        publisher.triggerPublish();

        verify(outboxMetrics).recordEventDeadLettered("AppointmentConfirmed");
    }

    @Test
    @DisplayName("One failing event does not stop the rest of the batch")
    void batchContinuesAfterFailure() {
        OutboxEvent failing = event(0);
        OutboxEvent ok = event(0);
        SendResult<String, String> result = acknowledged();
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(failing, ok));
        when(kafkaTemplate.send(TOPIC, failing.getAggregateId().toString(), failing.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unreachable")));
        when(kafkaTemplate.send(TOPIC, ok.getAggregateId().toString(), ok.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(result));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxService).markPublished(ok.getId());
    }
}

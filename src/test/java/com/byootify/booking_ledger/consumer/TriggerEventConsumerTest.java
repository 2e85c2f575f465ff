package com.byootify.booking_ledger.consumer;

import com.byootify.booking_ledger.observability.BookingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.kafka.support.Acknowledgment;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TriggerEventConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;

    @Mock
    private TriggerEventHandler eventHandler;

    @Mock
    private Acknowledgment ack;

    private TriggerEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new TriggerEventConsumer(eventProcessor, eventHandler, new ObjectMapper(),
                new BookingMetrics(new SimpleMeterRegistry()));
        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any())).thenAnswer(invocation -> {
            ((Runnable) invocation.getArgument(4)).run();
            return true;
        });
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("booking-triggers", 0, 42L, "key", value);
    }

    @Test
    @DisplayName("AppointmentCompleted is routed with its tip and the event id as trigger")
    void completionRouted() {
        UUID eventId = UUID.randomUUID();
        UUID appointmentId = UUID.randomUUID();

        consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"AppointmentCompleted\",\"appointmentId\":\"%s\",\"tipAmount\":500}",
                eventId, appointmentId)), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq("AppointmentCompleted"), eq(appointmentId.toString()),
                eq(TriggerEventConsumer.CONSUMER_GROUP), any());
        verify(eventHandler).onAppointmentCompleted(eventId, appointmentId, 500);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Tips and no-shows reach their handlers")
    void tipAndNoShowRouted() {
        UUID appointmentId = UUID.randomUUID();
        UUID tipEvent = UUID.randomUUID();
        UUID noShowEvent = UUID.randomUUID();

        consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"TipReceived\",\"appointmentId\":\"%s\",\"amount\":700}",
                tipEvent, appointmentId)), ack);
        consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"AppointmentNoShow\",\"appointmentId\":\"%s\"}",
                noShowEvent, appointmentId)), ack);

        verify(eventHandler).onTipReceived(tipEvent, appointmentId, 700);
        verify(eventHandler).onAppointmentNoShow(noShowEvent, appointmentId);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    @DisplayName("Transfer webhooks are keyed by transfer id")
    void transferEventsRouted() {
        consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"TransferFailed\",\"transferId\":\"tr_1\",\"reason\":\"account closed\"}",
                UUID.randomUUID())), ack);

        verify(eventHandler).onTransferFailed("tr_1", "account closed");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown event types are recorded as skipped")
    void unknownTypeSkipped() {
        UUID eventId = UUID.randomUUID();

        consumer.consume(record(String.format("{\"eventId\":\"%s\",\"eventType\":\"ReviewPosted\"}", eventId)), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("ReviewPosted"), any(), eq(TriggerEventConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable and incomplete messages are acknowledged and dropped")
    void malformedMessagesDropped() {
        consumer.consume(record("not json"), ack);
        consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"AppointmentCompleted\"}", UUID.randomUUID())), ack);

        verifyNoInteractions(eventHandler);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    @DisplayName("Infrastructure failures propagate without acknowledging")
    void failurePropagates() {
        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any()))
                .thenThrow(new QueryTimeoutException("database down"));

        assertThrows(QueryTimeoutException.class, () -> consumer.consume(record(String.format(
                "{\"eventId\":\"%s\",\"eventType\":\"AppointmentNoShow\",\"appointmentId\":\"%s\"}",
                UUID.randomUUID(), UUID.randomUUID())), ack));
        verify(ack, never()).acknowledge();
    }
}

package com.byootify.booking_ledger.consumer;

import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.observability.CorrelationContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Consumes completion, no-show, tip and transfer webhooks relayed onto the triggers topic.
 *
 * Offsets are acknowledged manually after the event was handled or recorded as skipped;
 * unparseable messages are acknowledged and dropped with a warning.
 *
 * Expected payload:
 * <pre>
 * {"eventId": "...", "eventType": "AppointmentCompleted", "appointmentId": "...", "tipAmount": 500}
 * {"eventId": "...", "eventType": "TransferFailed", "transferId": "...", "reason": "..."}
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TriggerEventConsumer {

    static final String CONSUMER_GROUP = "booking-trigger-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final TriggerEventHandler eventHandler;
    private final ObjectMapper objectMapper;
    private final BookingMetrics bookingMetrics;

    @KafkaListener(
        topics = "${booking.topic.triggers:booking-triggers}",
        groupId = "${spring.kafka.consumer.group-id:booking-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received trigger: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Header correlation = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String correlationId = correlation != null
                ? new String(correlation.value(), StandardCharsets.UTF_8)
                : CorrelationContext.generateCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

        try {
            JsonNode node = parse(record.value());
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType")) {
                log.warn("Could not parse trigger event, acknowledging to skip: offset={}", record.offset());
                ack.acknowledge();
                return;
            }

            UUID eventId = UUID.fromString(node.get("eventId").asText());
            String eventType = node.get("eventType").asText();
            boolean processed = route(eventId, eventType, node);
            bookingMetrics.recordEventProcessed(eventType, processed);
            ack.acknowledge();

        } catch (IllegalArgumentException e) {
            log.warn("Malformed trigger event at offset {}, acknowledging to skip: {}", record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing trigger at offset {}: {}", record.offset(), e.getMessage(), e);
            bookingMetrics.recordEventProcessingFailure("trigger", e.getClass().getSimpleName());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clearDomainKeys();
        }
    }

    private boolean route(UUID eventId, String eventType, JsonNode node) {
        return switch (eventType) {
            case "AppointmentCompleted" -> {
                UUID appointmentId = uuid(node, "appointmentId");
                yield eventProcessor.processEvent(eventId, eventType, appointmentId.toString(), CONSUMER_GROUP,
                        () -> eventHandler.onAppointmentCompleted(eventId, appointmentId, node.path("tipAmount").asLong(0)));
            }
            case "AppointmentNoShow" -> {
                UUID appointmentId = uuid(node, "appointmentId");
                yield eventProcessor.processEvent(eventId, eventType, appointmentId.toString(), CONSUMER_GROUP,
                        () -> eventHandler.onAppointmentNoShow(eventId, appointmentId));
            }
            case "TipReceived" -> {
                UUID appointmentId = uuid(node, "appointmentId");
                yield eventProcessor.processEvent(eventId, eventType, appointmentId.toString(), CONSUMER_GROUP,
                        () -> eventHandler.onTipReceived(eventId, appointmentId, node.path("amount").asLong(0)));
            }
            case "TransferSettled" -> {
                String transferId = text(node, "transferId");
                yield eventProcessor.processEvent(eventId, eventType, transferId, CONSUMER_GROUP,
                        () -> eventHandler.onTransferSettled(transferId));
            }
            case "TransferFailed" -> {
                String transferId = text(node, "transferId");
                String reason = node.path("reason").asText("Transfer failed");
                yield eventProcessor.processEvent(eventId, eventType, transferId, CONSUMER_GROUP,
                        () -> eventHandler.onTransferFailed(transferId, reason));
            }
            default -> {
                log.debug("Unknown trigger type {}, skipping", eventType);
                eventProcessor.skipEvent(eventId, eventType, null, CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private JsonNode parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse trigger event: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static UUID uuid(JsonNode node, String field) {
        return UUID.fromString(text(node, field));
    }

    private static String text(JsonNode node, String field) {
        if (!node.hasNonNull(field)) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return node.get(field).asText();
    }
}

package com.byootify.booking_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation ID plus the MDC keys used across booking, ledger and payout logs.
 *
 * The correlation ID comes from the X-Correlation-ID header (or is generated), is copied
 * onto outbox messages as a Kafka header and is restored by the trigger consumer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String APPOINTMENT_ID_MDC_KEY = "appointmentId";
    public static final String PROVIDER_ID_MDC_KEY = "providerId";
    public static final String PAYOUT_ID_MDC_KEY = "payoutId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for log readability.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    public static void putAppointment(UUID appointmentId, UUID providerId) {
        if (appointmentId != null) {
            MDC.put(APPOINTMENT_ID_MDC_KEY, appointmentId.toString());
        }
        if (providerId != null) {
            MDC.put(PROVIDER_ID_MDC_KEY, providerId.toString());
        }
    }

    public static void clearDomainKeys() {
        MDC.remove(APPOINTMENT_ID_MDC_KEY);
        MDC.remove(PROVIDER_ID_MDC_KEY);
        MDC.remove(PAYOUT_ID_MDC_KEY);
    }
}

package com.byootify.booking_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for booking, ledger and payout operations.
 *
 * Metrics exposed:
 * - booking.requests: booking requests by outcome (confirmed, conflict, outside_hours, declined, expired, confirm_failed)
 * - booking.transitions: appointment transitions by type and outcome
 * - calendar.holds.expired: tentative holds released by the sweep
 * - ledger.postings: ledger posting attempts by outcome (recorded, duplicate, degraded, halted)
 * - ledger.entries: appended entries by kind
 * - payouts: payouts by outcome (created, settled, reversed, transfer_failed)
 * - booking.latency: timer per operation
 */
@Component
public class BookingMetrics {

    private final MeterRegistry registry;

    private final Counter holdsExpired;
    private final Timer ledgerPostingTimer;

    public BookingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.holdsExpired = Counter.builder("calendar.holds.expired")
                .description("Number of tentative calendar holds released after expiry")
                .register(registry);

        this.ledgerPostingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to post ledger entries for a transition")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Booking ====================

    public void recordBookingRequest(String outcome) {
        registry.counter("booking.requests", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTransition(String type, String outcome) {
        registry.counter("booking.transitions",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordHoldsExpired(int count) {
        holdsExpired.increment(count);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("booking.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Ledger ====================

    public void recordLedgerPosting(String outcome) {
        registry.counter("ledger.postings", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLedgerEntry(String kind, String currency) {
        registry.counter("ledger.entries",
                "kind", sanitizeTag(kind),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordLedgerPostingDuration(Duration duration) {
        ledgerPostingTimer.record(duration);
    }

    // ==================== Payouts & settlements ====================

    public void recordPayout(String outcome, String currency) {
        registry.counter("payouts",
                "outcome", sanitizeTag(outcome),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordClientSettlement(String type, String outcome) {
        registry.counter("client.settlements",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    // ==================== Event intake ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", sanitizeTag(eventType))
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        Counter.builder("event.processing.failure")
                .tag("event_type", sanitizeTag(eventType))
                .tag("error", sanitizeTag(error))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.byootify.booking_ledger.observability;

import com.byootify.booking_ledger.booking.AppointmentTransitionRepository;
import com.byootify.booking_ledger.booking.LedgerStatus;
import com.byootify.booking_ledger.outbox.OutboxEventRepository;
import com.byootify.booking_ledger.settlement.ClientSettlementRepository;
import com.byootify.booking_ledger.settlement.SettlementStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backlog gauges for everything that is written now and delivered later:
 * outbox notifications, ledger postings that have not been recorded yet,
 * and client refund/charge instructions waiting for the processor.
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so a scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final AppointmentTransitionRepository transitionRepository;
    private final ClientSettlementRepository settlementRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);
    private final AtomicLong degradedPostings = new AtomicLong(0);
    private final AtomicLong haltedPostings = new AtomicLong(0);
    private final AtomicLong pendingSettlements = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetteredCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        Gauge.builder("ledger.postings.backlog", degradedPostings, AtomicLong::get)
                .description("Transitions whose ledger posting is waiting for a retry")
                .tag("ledger_status", "degraded")
                .register(meterRegistry);

        Gauge.builder("ledger.postings.backlog", haltedPostings, AtomicLong::get)
                .description("Transitions whose ledger posting was halted by an invariant violation")
                .tag("ledger_status", "halted")
                .register(meterRegistry);

        Gauge.builder("settlements.backlog.size", pendingSettlements, AtomicLong::get)
                .description("Client refunds and charges not yet sent to the processor")
                .register(meterRegistry);

        log.info("Backlog metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, clock.instant()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            deadLetteredCount.set(outboxRepository.countDeadLettered(maxRetries));
            degradedPostings.set(transitionRepository.countByLedgerStatus(LedgerStatus.DEGRADED));
            haltedPostings.set(transitionRepository.countByLedgerStatus(LedgerStatus.HALTED));
            pendingSettlements.set(settlementRepository.countByStatus(SettlementStatus.PENDING));

            log.debug("Backlog metrics refreshed: outbox={}, oldestAge={}s, degraded={}, halted={}",
                    unpublished, oldestEventAgeSeconds.get(), degradedPostings.get(), haltedPostings.get());

        } catch (DataAccessException e) {
            log.warn("Failed to refresh backlog metrics, keeping previous values: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}

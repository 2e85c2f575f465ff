package com.byootify.booking_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes the gauges that need a database query.
 */
@Component
@ConditionalOnProperty(name = "booking.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshBacklogMetrics() {
        outboxMetrics.refreshMetrics();
    }
}

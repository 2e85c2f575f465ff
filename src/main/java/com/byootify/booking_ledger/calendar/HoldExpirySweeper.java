package com.byootify.booking_ledger.calendar;

import com.byootify.booking_ledger.observability.BookingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Releases tentative holds whose hold window lapsed without confirmation.
 *
 * Each provider is swept in its own transaction under its own lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HoldExpirySweeper {

    private final CalendarService calendarService;
    private final BookingMetrics bookingMetrics;

    @Scheduled(fixedDelayString = "${booking.calendar.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            int released = sweepOnce();
            if (released > 0) {
                log.info("Released {} lapsed calendar holds", released);
            }
        } catch (Exception e) {
            log.error("Error in calendar hold sweep", e);
        }
    }

    /**
     * Runs one sweep synchronously.
     *
     * @return total holds released
     */
    public int sweepOnce() {
        List<UUID> providers = calendarService.providersWithLapsedHolds();
        int total = 0;
        for (UUID providerId : providers) {
            int released = calendarService.sweepExpiredHolds(providerId);
            total += released;
            log.debug("Swept provider calendar: providerId={}, released={}", providerId, released);
        }
        bookingMetrics.recordHoldsExpired(total);
        return total;
    }
}

package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Completes confirmed appointments nobody confirmed once {@code end + auto-complete-grace}
 * has passed. The trigger id is derived from the appointment, so overlapping runs apply
 * each completion once.
 */
@Component
@ConditionalOnProperty(name = "booking.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AutoCompletionScheduler {

    private final AppointmentRepository appointmentRepository;
    private final BookingService bookingService;
    private final BookingProperties properties;
    private final Clock clock;

    static String autoCompleteTrigger(UUID appointmentId) {
        return "auto-complete:" + appointmentId;
    }

    @Scheduled(fixedDelayString = "${booking.auto-complete-interval-ms:60000}")
    public void completeOverdue() {
        int completed = completeOnce(100);
        if (completed > 0) {
            log.info("Auto-completed {} appointments", completed);
        }
    }

    public int completeOnce(int batchSize) {
        Instant endedBefore = clock.instant().minus(properties.getAutoCompleteGrace());
        List<UUID> due = appointmentRepository.findConfirmedEndedBefore(endedBefore, PageRequest.of(0, batchSize));

        int completed = 0;
        for (UUID appointmentId : due) {
            try {
                bookingService.complete(appointmentId, autoCompleteTrigger(appointmentId), 0);
                completed++;
            } catch (IllegalStateException e) {
                // cancelled or marked no-show since the query ran
                log.info("Skipping auto-completion of {}: {}", appointmentId, e.getMessage());
            }
        }
        return completed;
    }
}

package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.config.BookingProperties;
import com.byootify.booking_ledger.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Re-posts DEGRADED transitions, and PENDING ones whose request thread died before posting.
 * Only the ledger step is repeated; calendar admission is never re-attempted.
 */
@Component
@ConditionalOnProperty(name = "booking.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingRetrier {

    private final AppointmentTransitionRepository transitionRepository;
    private final LedgerPostingService ledgerPostingService;
    private final BookingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${booking.ledger-retry.interval-ms:60000}")
    public void retryPending() {
        int recorded = retryOnce(100);
        if (recorded > 0) {
            log.info("Ledger retry pass recorded {} postings", recorded);
        }
    }

    /**
     * @return number of transitions that reached RECORDED in this pass
     */
    public int retryOnce(int batchSize) {
        List<UUID> ids = transitionRepository.findPostingsToRetry(
                clock.instant().minus(properties.getLedgerRetry().getPendingGrace()), PageRequest.of(0, batchSize));

        int recorded = 0;
        for (UUID id : ids) {
            try {
                if (ledgerPostingService.post(id) == LedgerStatus.RECORDED) {
                    recorded++;
                }
            } catch (InvariantViolationException e) {
                log.error("Transition {} halted during ledger retry, continuing with the next one", id);
            }
        }
        return recorded;
    }
}

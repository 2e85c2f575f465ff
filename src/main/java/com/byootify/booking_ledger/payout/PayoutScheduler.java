package com.byootify.booking_ledger.payout;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily payout sweep plus the periodic reconciliation pass.
 */
@Component
@ConditionalOnProperty(name = "booking.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PayoutScheduler {

    private final PayoutService payoutService;

    @Scheduled(cron = "${booking.payout.cron:0 0 6 * * *}", zone = "${booking.payout.zone:UTC}")
    public void runDailyCycle() {
        payoutService.runCycle(payoutService.currentCutoff());
    }

    @Scheduled(fixedDelayString = "${booking.payout.reconcile-interval-ms:300000}")
    public void reconcile() {
        int finished = payoutService.reconcile();
        if (finished > 0) {
            log.info("Payout reconciliation finished {} payouts", finished);
        }
    }
}

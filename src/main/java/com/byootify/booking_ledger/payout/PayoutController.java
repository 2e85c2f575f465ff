package com.byootify.booking_ledger.payout;

import com.byootify.booking_ledger.payout.dto.PayoutResponse;
import com.byootify.booking_ledger.payout.dto.PayoutScheduleRequest;
import com.byootify.booking_ledger.payout.dto.PayoutScheduleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read access to payouts, provider payout schedules, plus operator triggers for the sweep and
 * reconciliation.
 */
@RestController
@RequestMapping("/api/payouts")
@RequiredArgsConstructor
@Slf4j
public class PayoutController {

    private final PayoutService payoutService;

    @GetMapping
    public ResponseEntity<List<PayoutResponse>> listPayouts(@RequestParam("provider_id") UUID providerId) {
        return ResponseEntity.ok(payoutService.payoutsFor(providerId).stream().map(PayoutResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PayoutResponse> getPayout(@PathVariable("id") UUID id) {
        return payoutService.findById(id)
            .map(payout -> ResponseEntity.ok(PayoutResponse.from(payout)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Runs the sweep now. Defaults to the scheduler's cutoff; re-running a cutoff creates nothing new.
     */
    @PostMapping("/run")
    public ResponseEntity<List<PayoutResponse>> runCycle(
            @RequestParam(value = "cutoff", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant cutoff) {
        Instant effectiveCutoff = cutoff != null ? cutoff : payoutService.currentCutoff();
        log.info("Manual payout cycle requested: cutoff={}", effectiveCutoff);
        return ResponseEntity.ok(payoutService.runCycle(effectiveCutoff).stream().map(PayoutResponse::from).toList());
    }

    @PostMapping("/reconcile")
    public ResponseEntity<Map<String, Integer>> reconcile() {
        return ResponseEntity.ok(Map.of("finished", payoutService.reconcile()));
    }

    @GetMapping("/schedules/{providerId}")
    public ResponseEntity<PayoutScheduleResponse> getSchedule(@PathVariable("providerId") UUID providerId) {
        return payoutService.scheduleFor(providerId)
            .map(schedule -> ResponseEntity.ok(PayoutScheduleResponse.from(schedule)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/schedules/{providerId}")
    public ResponseEntity<PayoutScheduleResponse> updateSchedule(@PathVariable("providerId") UUID providerId,
                                                                 @Valid @RequestBody PayoutScheduleRequest request) {
        return ResponseEntity.ok(PayoutScheduleResponse.from(payoutService.updateSchedule(providerId,
                request.getFrequency(), request.minimumAmountOrDefault(), request.payoutDayOrDefault(),
                request.activeOrDefault())));
    }
}

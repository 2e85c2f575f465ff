package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.exception.InvariantViolationException;
import com.byootify.booking_ledger.fee.FeeEvent;
import com.byootify.booking_ledger.fee.FeePolicyEngine;
import com.byootify.booking_ledger.ledger.AppendResult;
import com.byootify.booking_ledger.ledger.LedgerEntryDraft;
import com.byootify.booking_ledger.ledger.LedgerPosting;
import com.byootify.booking_ledger.ledger.LedgerService;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.settlement.ClientSettlementService;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records the ledger entries of a committed transition.
 *
 * Runs after the state change has committed, never inside it. Each attempt locks the history
 * row, prices the transition with the appointment's fee schedule snapshot, appends the entries
 * and derives the client refund/charge instructions in one transaction. Infrastructure failures
 * are retried with backoff; exhaustion leaves the transition DEGRADED for
 * {@link LedgerPostingRetrier}. An invariant violation HALTs the transition for an operator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingService {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentTransitionRepository transitionRepository;
    private final FeePolicyEngine feePolicyEngine;
    private final LedgerService ledgerService;
    private final ClientSettlementService settlementService;
    private final TransactionTemplate transactionTemplate;
    private final Retry ledgerPostingRetry;
    private final BookingMetrics bookingMetrics;

    /**
     * @return the ledger status of the transition after this call
     * @throws InvariantViolationException when the entries for the transition are inconsistent
     */
    public LedgerStatus post(UUID transitionId) {
        long start = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        try {
            LedgerStatus status = ledgerPostingRetry.executeSupplier(() -> {
                attempts.incrementAndGet();
                return transactionTemplate.execute(tx -> attempt(transitionId));
            });
            bookingMetrics.recordLedgerPostingDuration(Duration.ofNanos(System.nanoTime() - start));
            return status;

        } catch (InvariantViolationException e) {
            log.error("INVARIANT VIOLATION while posting transition {}: {}", transitionId, e.getMessage(), e);
            transactionTemplate.executeWithoutResult(tx -> transitionRepository.findForUpdate(transitionId)
                .ifPresent(transition -> transition.markHalted(e.getMessage())));
            bookingMetrics.recordLedgerPosting("halted");
            throw e;

        } catch (RuntimeException e) {
            log.warn("Ledger posting for transition {} failed after {} attempts, marking DEGRADED: {}",
                    transitionId, attempts.get(), e.getMessage());
            transactionTemplate.executeWithoutResult(tx -> transitionRepository.findForUpdate(transitionId)
                .ifPresent(transition -> transition.markDegraded(attempts.get(), e.getMessage())));
            bookingMetrics.recordLedgerPosting("degraded");
            return LedgerStatus.DEGRADED;
        }
    }

    private LedgerStatus attempt(UUID transitionId) {
        AppointmentTransitionEntity transition = transitionRepository.findForUpdate(transitionId)
            .orElseThrow(() -> new IllegalStateException("Transition not found: " + transitionId));
        if (transition.getLedgerStatus() == LedgerStatus.RECORDED || transition.getLedgerStatus() == LedgerStatus.HALTED) {
            return transition.getLedgerStatus();
        }

        Appointment appointment = appointmentRepository.findById(transition.getAppointmentId())
            .map(AppointmentEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "Appointment " + transition.getAppointmentId() + " missing for transition " + transitionId));

        List<LedgerEntryDraft> drafts = feePolicyEngine.computeEntries(appointment.getFeeSchedule(),
                appointment.getServicePrice(), appointment.getCurrency(), feeEventFor(transition));

        AppendResult result = ledgerService.append(LedgerPosting.forAppointment(
            appointment.getId(), appointment.getProviderId(), appointment.getClientId(),
            transition.getTriggerEventId(), transition.getOccurredAt(), drafts));

        settlementService.recordInstructions(appointment.getId(), appointment.getHoldToken(),
                appointment.getPaymentMethod(), result.getEntries());

        transition.markRecorded();
        bookingMetrics.recordLedgerPosting(result.isApplied() ? "recorded" : "duplicate");
        log.info("Ledger posted: appointmentId={}, transition={}, trigger={}, entries={}, applied={}",
                appointment.getId(), transition.getType(), transition.getTriggerEventId(),
                result.getEntries().size(), result.isApplied());
        return LedgerStatus.RECORDED;
    }

    static FeeEvent feeEventFor(AppointmentTransitionEntity transition) {
        return switch (transition.getType()) {
            case CONFIRM -> FeeEvent.confirmed();
            case COMPLETE -> FeeEvent.completed(transition.getTipAmount());
            case CANCEL -> FeeEvent.cancelled(transition.getCancelledBy(), transition.isShortNotice());
            case NO_SHOW -> FeeEvent.noShow();
            case TIP -> FeeEvent.tip(transition.getTipAmount());
        };
    }
}

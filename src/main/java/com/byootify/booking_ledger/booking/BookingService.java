package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.calendar.CalendarService;
import com.byootify.booking_ledger.exception.AppointmentNotFoundException;
import com.byootify.booking_ledger.exception.ConflictException;
import com.byootify.booking_ledger.exception.OutsideWorkingHoursException;
import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.exception.ProcessorUnavailableException;
import com.byootify.booking_ledger.exception.ReservationExpiredException;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.byootify.booking_ledger.fee.FeePolicyEngine;
import com.byootify.booking_ledger.fee.FeeSchedule;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.observability.CorrelationContext;
import com.byootify.booking_ledger.processor.PaymentProcessorClient;
import com.byootify.booking_ledger.settlement.ClientSettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the booking lifecycle.
 *
 * A request moves REQUESTED → tentative hold → hold capture → CONFIRMED. The processor is
 * called between the calendar transactions, never under a lock. A rejected request is
 * discarded: its tentative hold is released, any captured hold is refunded and an audit row
 * records why.
 *
 * Every committed transition is then handed to {@link LedgerPostingService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final CalendarService calendarService;
    private final AppointmentTransitionService transitionService;
    private final LedgerPostingService ledgerPostingService;
    private final IdempotencyService idempotencyService;
    private final FeePolicyEngine feePolicyEngine;
    private final PaymentProcessorClient paymentProcessor;
    private final ClientSettlementService settlementService;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentTransitionRepository transitionRepository;
    private final BookingAuditRepository auditRepository;
    private final BookingMetrics bookingMetrics;
    private final Clock clock;

    /**
     * Books {@code request.interval} with the provider.
     *
     * Retrying with the same idempotency key returns the appointment created by the first call
     * with {@code replayed = true}.
     *
     * @throws ConflictException if the window overlaps another booking
     * @throws OutsideWorkingHoursException if the provider does not work during the window
     * @throws PaymentDeclinedException if the hold cannot be captured
     * @throws ReservationExpiredException if the tentative hold lapsed before confirmation
     * @throws RuntimeException any other confirmation failure, after the hold is refunded and the interval released
     */
    public AppointmentDetails request(BookingRequest request, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String requestKey = IdempotencyService.requestKey(request.getClientId(), idempotencyKey);

        Optional<UUID> existing = idempotencyService.findAppointment(requestKey);
        if (existing.isPresent()) {
            bookingMetrics.recordIdempotencyHit();
            bookingMetrics.recordBookingRequest("replayed");
            log.info("Idempotency key already used, returning appointment {}", existing.get());
            return details(existing.get(), true);
        }
        bookingMetrics.recordIdempotencyMiss();

        UUID appointmentId = IdempotencyService.appointmentIdFor(requestKey);
        CorrelationContext.putAppointment(appointmentId, request.getProviderId());

        Appointment requested = Appointment.request(appointmentId, request.getClientId(), request.getProviderId(),
                request.getServicePrice(), request.getCurrency(), request.getInterval(), request.getPaymentMethod(),
                now());

        try {
            calendarService.tryReserve(request.getProviderId(), appointmentId, request.getInterval());
        } catch (ConflictException e) {
            reject(appointmentId, request, "CONFLICT", e.getMessage());
            throw e;
        } catch (OutsideWorkingHoursException e) {
            reject(appointmentId, request, "OUTSIDE_HOURS", e.getMessage());
            throw e;
        }

        FeeSchedule schedule = feePolicyEngine.currentSchedule();
        long holdAmount = schedule.holdAmount(request.getServicePrice());
        String holdToken = null;
        if (holdAmount > 0) {
            try {
                holdToken = paymentProcessor.captureHold(holdAmount, request.getCurrency(),
                        request.getPaymentMethod(), "hold:" + appointmentId);
            } catch (PaymentDeclinedException | ProcessorUnavailableException e) {
                calendarService.release(request.getProviderId(), appointmentId);
                reject(appointmentId, request,
                        e instanceof PaymentDeclinedException ? "DECLINED" : "PROCESSOR_UNAVAILABLE", e.getMessage());
                throw e;
            }
        }

        TransitionOutcome outcome;
        try {
            outcome = transitionService.confirm(requested, holdToken, holdAmount, schedule, requestKey);
        } catch (ReservationExpiredException e) {
            unwind(appointmentId, request, holdToken, holdAmount);
            reject(appointmentId, request, "EXPIRED", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Confirmation failed after hold capture: appointmentId={}, holdCaptured={}",
                    appointmentId, holdToken != null, e);
            unwind(appointmentId, request, holdToken, holdAmount);
            reject(appointmentId, request, "CONFIRM_FAILED", e.getMessage());
            throw e;
        }

        if (outcome.isApplied()) {
            ledgerPostingService.post(outcome.getTransition().getId());
        }
        idempotencyService.store(requestKey, appointmentId);

        long duration = System.currentTimeMillis() - startTime;
        bookingMetrics.recordBookingRequest(outcome.isApplied() ? "confirmed" : "replayed");
        bookingMetrics.recordLatency("request", duration);
        log.info("Booking request handled: appointmentId={}, providerId={}, interval={}, duration={}ms",
                appointmentId, request.getProviderId(), request.getInterval(), duration);
        return details(appointmentId, !outcome.isApplied());
    }

    public AppointmentDetails cancel(UUID appointmentId, String triggerEventId, CancellationParty cancelledBy) {
        return transition(appointmentId, TransitionType.CANCEL, triggerEventId, cancelledBy, 0);
    }

    public AppointmentDetails complete(UUID appointmentId, String triggerEventId, long tipAmount) {
        return transition(appointmentId, TransitionType.COMPLETE, triggerEventId, null, tipAmount);
    }

    public AppointmentDetails markNoShow(UUID appointmentId, String triggerEventId) {
        return transition(appointmentId, TransitionType.NO_SHOW, triggerEventId, null, 0);
    }

    public AppointmentDetails addTip(UUID appointmentId, String triggerEventId, long tipAmount) {
        return transition(appointmentId, TransitionType.TIP, triggerEventId, null, tipAmount);
    }

    @Transactional(readOnly = true)
    public AppointmentDetails getAppointment(UUID appointmentId) {
        return details(appointmentId, false);
    }

    @Transactional(readOnly = true)
    public List<Appointment> appointmentsForProvider(UUID providerId) {
        return appointmentRepository.findByProviderIdOrderByStartAtAsc(providerId)
            .stream()
            .map(AppointmentEntity::toDomain)
            .toList();
    }

    private AppointmentDetails transition(UUID appointmentId, TransitionType type, String triggerEventId,
                                          CancellationParty cancelledBy, long tipAmount) {
        long startTime = System.currentTimeMillis();
        TransitionOutcome outcome = transitionService.apply(appointmentId, type, triggerEventId, cancelledBy, tipAmount);
        CorrelationContext.putAppointment(appointmentId, outcome.getAppointment().getProviderId());

        if (outcome.isApplied()) {
            ledgerPostingService.post(outcome.getTransition().getId());
        }

        bookingMetrics.recordLatency(type.name().toLowerCase(), System.currentTimeMillis() - startTime);
        return details(appointmentId, !outcome.isApplied());
    }

    private AppointmentDetails details(UUID appointmentId, boolean replayed) {
        Appointment appointment = appointmentRepository.findById(appointmentId)
            .map(AppointmentEntity::toDomain)
            .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
        List<AppointmentTransition> history = transitionRepository.findByAppointmentIdOrderByOccurredAtAsc(appointmentId)
            .stream()
            .map(AppointmentTransitionEntity::toDomain)
            .toList();
        return new AppointmentDetails(appointment, history, replayed);
    }

    /**
     * Gives back what a failed confirmation left behind: the tentative interval and the captured
     * hold. Each step logs its own failure so the caller still sees the original exception.
     */
    private void unwind(UUID appointmentId, BookingRequest request, String holdToken, long holdAmount) {
        try {
            calendarService.release(request.getProviderId(), appointmentId);
        } catch (RuntimeException e) {
            log.error("Failed to release interval of appointment {}, the expiry sweep will free it: {}",
                    appointmentId, e.getMessage());
        }
        if (holdToken == null) {
            return;
        }
        try {
            settlementService.scheduleHoldRefund(appointmentId, holdToken, holdAmount, request.getCurrency());
        } catch (RuntimeException e) {
            log.error("HOLD REFUND NOT SCHEDULED: appointmentId={}, holdToken={}, amount={} {}",
                    appointmentId, holdToken, holdAmount, request.getCurrency(), e);
        }
    }

    private void reject(UUID appointmentId, BookingRequest request, String outcome, String detail) {
        bookingMetrics.recordBookingRequest(outcome.toLowerCase());
        log.info("Booking request rejected: appointmentId={}, providerId={}, outcome={}, detail={}",
                appointmentId, request.getProviderId(), outcome, detail);
        try {
            auditRepository.save(BookingAuditEntity.rejected(appointmentId, request, outcome, detail, now()));
        } catch (DataAccessException e) {
            log.error("Failed to write booking audit row for appointment {}: {}", appointmentId, e.getMessage());
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}

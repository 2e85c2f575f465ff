package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.booking.event.AppointmentCancelledEvent;
import com.byootify.booking_ledger.booking.event.AppointmentCompletedEvent;
import com.byootify.booking_ledger.booking.event.AppointmentConfirmedEvent;
import com.byootify.booking_ledger.calendar.CalendarService;
import com.byootify.booking_ledger.config.BookingProperties;
import com.byootify.booking_ledger.exception.AppointmentNotFoundException;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.byootify.booking_ledger.fee.FeeSchedule;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies appointment state transitions under the appointment's row lock.
 *
 * Each method commits the new state, its history row and its outbox event together. Ledger
 * posting happens afterwards in {@link LedgerPostingService}, keyed by the history row.
 *
 * Idempotence rules:
 * - a trigger event id already in the history is a no-op returning the current state
 * - reaching the current state again through another trigger is a no-op
 * - leaving a different terminal state is an {@link IllegalStateException}
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentTransitionService {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentTransitionRepository transitionRepository;
    private final CalendarService calendarService;
    private final OutboxService outboxService;
    private final BookingProperties properties;
    private final BookingMetrics bookingMetrics;
    private final Clock clock;

    static String confirmTrigger(UUID appointmentId) {
        return "confirm:" + appointmentId;
    }

    /**
     * Promotes the tentative hold and persists the CONFIRMED appointment in one transaction.
     *
     * A concurrent duplicate of the same request finds the interval already confirmed and the
     * appointment row present, and returns it unchanged.
     */
    @Transactional
    public TransitionOutcome confirm(Appointment requested, String holdToken, long holdAmount,
                                     FeeSchedule schedule, String requestKey) {
        calendarService.confirm(requested.getProviderId(), requested.getId());

        Optional<AppointmentEntity> existing = appointmentRepository.findById(requested.getId());
        if (existing.isPresent()) {
            log.info("Appointment {} was already confirmed by a concurrent request", requested.getId());
            return TransitionOutcome.unchanged(existing.get().toDomain());
        }

        Instant now = now();
        Appointment confirmed = requested.confirm(holdToken, holdAmount, schedule, now);
        appointmentRepository.save(AppointmentEntity.fromDomain(confirmed, requestKey));

        AppointmentTransitionEntity transition = transitionRepository.save(AppointmentTransitionEntity.record(
            confirmed.getId(), TransitionType.CONFIRM, AppointmentStatus.REQUESTED,
            confirmTrigger(confirmed.getId()), null, false, 0, now));

        outboxService.saveEvent(OutboxService.APPOINTMENT_AGGREGATE, confirmed.getId(),
                AppointmentConfirmedEvent.EVENT_TYPE, AppointmentConfirmedEvent.from(confirmed, now));

        bookingMetrics.recordTransition(TransitionType.CONFIRM.name(), "applied");
        log.info("Appointment confirmed: appointmentId={}, providerId={}, interval={}",
                confirmed.getId(), confirmed.getProviderId(), confirmed.getInterval());
        return TransitionOutcome.applied(confirmed, transition.toDomain());
    }

    /**
     * Applies COMPLETE, CANCEL, NO_SHOW or TIP.
     *
     * @param cancelledBy required for CANCEL, ignored otherwise
     * @param tipAmount optional tip for COMPLETE, required and positive for TIP
     */
    @Transactional
    public TransitionOutcome apply(UUID appointmentId, TransitionType type, String triggerEventId,
                                   CancellationParty cancelledBy, long tipAmount) {
        if (type == TransitionType.CONFIRM) {
            throw new IllegalArgumentException("Confirmation goes through the booking request flow");
        }
        if (triggerEventId == null || triggerEventId.isBlank()) {
            throw new IllegalArgumentException("Trigger event id is required");
        }
        if (tipAmount < 0) {
            throw new IllegalArgumentException("Tip must not be negative: " + tipAmount);
        }

        AppointmentEntity entity = appointmentRepository.findForUpdate(appointmentId)
            .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
        Appointment current = entity.toDomain();

        if (transitionRepository.findByAppointmentIdAndTriggerEventId(appointmentId, triggerEventId).isPresent()) {
            log.info("Trigger {} already applied to appointment {}, returning current state",
                    triggerEventId, appointmentId);
            bookingMetrics.recordTransition(type.name(), "replayed");
            return TransitionOutcome.unchanged(current);
        }

        Instant now = now();
        if (type == TransitionType.TIP) {
            return recordTip(current, triggerEventId, tipAmount, now);
        }

        if (current.getStatus() == type.getTarget()) {
            log.info("Appointment {} is already {}, ignoring trigger {}", appointmentId, current.getStatus(), triggerEventId);
            bookingMetrics.recordTransition(type.name(), "already_applied");
            return TransitionOutcome.unchanged(current);
        }

        boolean shortNotice = false;
        Appointment next;
        switch (type) {
            case CANCEL -> {
                if (cancelledBy == null) {
                    throw new IllegalArgumentException("Cancelling party is required");
                }
                next = current.cancel(cancelledBy, now);
                shortNotice = cancelledBy == CancellationParty.CLIENT
                        && current.isShortNotice(now, properties.getShortNoticeWindow());
                calendarService.release(current.getProviderId(), appointmentId);
            }
            case COMPLETE -> next = current.complete(now);
            case NO_SHOW -> {
                next = current.markNoShow(now);
                calendarService.release(current.getProviderId(), appointmentId);
            }
            default -> throw new IllegalArgumentException("Unsupported transition " + type);
        }

        entity.updateFromDomain(next);
        AppointmentTransitionEntity transition = transitionRepository.save(AppointmentTransitionEntity.record(
            appointmentId, type, current.getStatus(), triggerEventId,
            type == TransitionType.CANCEL ? cancelledBy : null, shortNotice,
            type == TransitionType.COMPLETE ? tipAmount : 0, now));

        if (type == TransitionType.CANCEL) {
            outboxService.saveEvent(OutboxService.APPOINTMENT_AGGREGATE, appointmentId,
                    AppointmentCancelledEvent.EVENT_TYPE, AppointmentCancelledEvent.from(next, shortNotice, now));
        } else {
            outboxService.saveEvent(OutboxService.APPOINTMENT_AGGREGATE, appointmentId,
                    AppointmentCompletedEvent.EVENT_TYPE,
                    AppointmentCompletedEvent.from(next, type == TransitionType.COMPLETE ? tipAmount : 0, now));
        }

        bookingMetrics.recordTransition(type.name(), "applied");
        log.info("Appointment transition applied: appointmentId={}, {} -> {}, trigger={}, shortNotice={}",
                appointmentId, current.getStatus(), next.getStatus(), triggerEventId, shortNotice);
        return TransitionOutcome.applied(next, transition.toDomain());
    }

    private TransitionOutcome recordTip(Appointment current, String triggerEventId, long tipAmount, Instant now) {
        if (current.getStatus() != AppointmentStatus.COMPLETED) {
            throw new IllegalStateException(String.format(
                "Cannot tip appointment %s in %s status. Appointment must be COMPLETED.",
                current.getId(), current.getStatus()));
        }
        if (tipAmount <= 0) {
            throw new IllegalArgumentException("Tip must be positive: " + tipAmount);
        }

        AppointmentTransitionEntity transition = transitionRepository.save(AppointmentTransitionEntity.record(
            current.getId(), TransitionType.TIP, current.getStatus(), triggerEventId, null, false, tipAmount, now));

        bookingMetrics.recordTransition(TransitionType.TIP.name(), "applied");
        log.info("Tip recorded: appointmentId={}, amount={} {}", current.getId(), tipAmount, current.getCurrency());
        return TransitionOutcome.applied(current, transition.toDomain());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}

package com.byootify.booking_ledger.calendar;

import com.byootify.booking_ledger.config.BookingProperties;
import com.byootify.booking_ledger.exception.ConflictException;
import com.byootify.booking_ledger.exception.OutsideWorkingHoursException;
import com.byootify.booking_ledger.exception.ReservationExpiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Calendar store: per-provider ordered set of committed intervals.
 *
 * Key principles:
 * - Every mutation for a provider runs under that provider's row lock
 * - Intervals of one provider stay pairwise disjoint under half-open comparison
 * - Tentative holds expire; lapsed holds never block a new admission
 * - A provider with published working hours only admits windows inside one of them
 * - No operation ever takes two provider locks
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarService {

    private final ProviderCalendarRepository calendarRepository;
    private final BookedIntervalRepository intervalRepository;
    private final WorkingHoursRepository workingHoursRepository;
    private final BookingProperties properties;
    private final Clock clock;

    /**
     * Atomically admits {@code interval} as a tentative hold for {@code appointmentId}.
     *
     * Idempotent per appointment: a live hold for the same window is returned as-is.
     *
     * @throws ConflictException if the window overlaps a confirmed interval or a live hold
     * @throws OutsideWorkingHoursException if the provider publishes hours and none covers the window
     */
    @Transactional
    public Reservation tryReserve(UUID providerId, UUID appointmentId, TimeInterval interval) {
        Instant now = now();
        ProviderCalendarEntity calendar = lockCalendar(providerId);
        requireWithinWorkingHours(providerId, interval);

        Optional<BookedIntervalEntity> existing = intervalRepository.findByAppointmentId(appointmentId);
        if (existing.isPresent()) {
            BookedIntervalEntity row = existing.get();
            if (!row.getProviderId().equals(providerId)) {
                throw new IllegalArgumentException(
                    "Appointment " + appointmentId + " is held on another provider's calendar");
            }
            if (row.isLapsed(now)) {
                intervalRepository.deleteByIds(List.of(row.getId()));
            } else if (row.interval().equals(interval)) {
                log.debug("Reservation already held: providerId={}, appointmentId={}", providerId, appointmentId);
                return toReservation(row);
            } else {
                throw new IllegalArgumentException(
                    "Appointment " + appointmentId + " already holds a different calendar interval");
            }
        }

        List<BookedIntervalEntity> overlapping =
            intervalRepository.findOverlapping(providerId, interval.getStart(), interval.getEnd());

        List<UUID> lapsed = overlapping.stream()
            .filter(row -> row.isLapsed(now))
            .map(BookedIntervalEntity::getId)
            .toList();
        if (!lapsed.isEmpty()) {
            intervalRepository.deleteByIds(lapsed);
            log.debug("Discarded {} lapsed holds overlapping {}", lapsed.size(), interval);
        }

        boolean blocked = overlapping.stream().anyMatch(row -> !row.isLapsed(now));
        if (blocked) {
            log.info("Calendar conflict: providerId={}, requested={}", providerId, interval);
            throw new ConflictException(interval);
        }

        Instant expiresAt = now.plus(properties.getCalendar().getHoldTtl());
        BookedIntervalEntity hold = BookedIntervalEntity.tentative(providerId, appointmentId, interval, expiresAt);
        intervalRepository.save(hold);
        calendar.recordMutation(now);

        log.debug("Tentative hold admitted: providerId={}, appointmentId={}, interval={}, expiresAt={}",
                providerId, appointmentId, interval, expiresAt);
        return toReservation(hold);
    }

    /**
     * Promotes a still-valid tentative hold to CONFIRMED. Joins the caller's transaction so the
     * promotion commits together with the appointment row.
     *
     * @throws ReservationExpiredException if the hold lapsed or was swept
     */
    @Transactional
    public BookedInterval confirm(UUID providerId, UUID appointmentId) {
        Instant now = now();
        ProviderCalendarEntity calendar = lockCalendar(providerId);

        BookedIntervalEntity row = intervalRepository.findByProviderIdAndAppointmentId(providerId, appointmentId)
            .orElseThrow(() -> new ReservationExpiredException(appointmentId));

        if (row.getStatus() == IntervalStatus.CONFIRMED) {
            return row.toDomain();
        }
        if (row.isLapsed(now)) {
            // Rolls back with the caller; the row is removed by release or the expiry sweep.
            throw new ReservationExpiredException(appointmentId);
        }

        row.confirm();
        calendar.recordMutation(now);
        log.debug("Interval confirmed: providerId={}, appointmentId={}", providerId, appointmentId);
        return row.toDomain();
    }

    /**
     * Removes the appointment's interval. Releasing an absent interval is a no-op.
     */
    @Transactional
    public boolean release(UUID providerId, UUID appointmentId) {
        ProviderCalendarEntity calendar = lockCalendar(providerId);
        int deleted = intervalRepository.deleteByProviderAndAppointment(providerId, appointmentId);
        if (deleted > 0) {
            calendar.recordMutation(now());
            log.debug("Interval released: providerId={}, appointmentId={}", providerId, appointmentId);
        }
        return deleted > 0;
    }

    /**
     * Busy windows of the provider overlapping {@code [from, to)}.
     *
     * Reads a consistent snapshot without taking the provider lock. Only the windows are
     * exposed, never the appointments behind them.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<TimeInterval> availability(UUID providerId, Instant from, Instant to) {
        TimeInterval range = TimeInterval.of(from, to);
        Instant now = now();
        return intervalRepository.findOverlapping(providerId, range.getStart(), range.getEnd())
            .stream()
            .filter(row -> !row.isLapsed(now))
            .map(BookedIntervalEntity::interval)
            .toList();
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public boolean isAvailable(UUID providerId, TimeInterval interval) {
        return availability(providerId, interval.getStart(), interval.getEnd()).isEmpty();
    }

    @Transactional(readOnly = true)
    public Optional<BookedInterval> findInterval(UUID appointmentId) {
        return intervalRepository.findByAppointmentId(appointmentId).map(BookedIntervalEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<UUID> providersWithLapsedHolds() {
        return intervalRepository.findProvidersWithLapsedHolds(now());
    }

    /**
     * Deletes the provider's lapsed tentative holds under its lock.
     *
     * @return number of holds released
     */
    @Transactional
    public int sweepExpiredHolds(UUID providerId) {
        Instant now = now();
        ProviderCalendarEntity calendar = lockCalendar(providerId);
        int deleted = intervalRepository.deleteLapsedHolds(providerId, now);
        if (deleted > 0) {
            calendar.recordMutation(now);
        }
        return deleted;
    }

    /**
     * Replaces the provider's weekly hours. An empty list lifts the restriction.
     */
    @Transactional
    public List<WorkingHours> replaceWorkingHours(UUID providerId, List<WorkingHours> hours) {
        ProviderCalendarEntity calendar = lockCalendar(providerId);
        workingHoursRepository.deleteByProvider(providerId);
        workingHoursRepository.saveAll(hours.stream().map(h -> WorkingHoursEntity.of(providerId, h)).toList());
        calendar.recordMutation(now());
        log.info("Working hours replaced: providerId={}, shifts={}", providerId, hours.size());
        return hours;
    }

    @Transactional(readOnly = true)
    public List<WorkingHours> workingHours(UUID providerId) {
        return workingHoursRepository.findByProviderIdOrderByDayOfWeekAscStartTimeAsc(providerId)
            .stream()
            .map(WorkingHoursEntity::toDomain)
            .toList();
    }

    private void requireWithinWorkingHours(UUID providerId, TimeInterval interval) {
        List<WorkingHours> hours = workingHours(providerId);
        if (!hours.isEmpty() && hours.stream().noneMatch(shift -> shift.covers(interval))) {
            log.info("Window outside working hours: providerId={}, requested={}", providerId, interval);
            throw new OutsideWorkingHoursException(providerId, interval);
        }
    }

    private ProviderCalendarEntity lockCalendar(UUID providerId) {
        calendarRepository.ensureExists(providerId);
        return calendarRepository.findForUpdate(providerId)
            .orElseThrow(() -> new IllegalStateException("Calendar row missing for provider " + providerId));
    }

    private Reservation toReservation(BookedIntervalEntity row) {
        return new Reservation(row.getProviderId(), row.getAppointmentId(), row.interval(), row.getExpiresAt());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}

package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.AbstractIntegrationTest;
import com.byootify.booking_ledger.calendar.CalendarService;
import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.calendar.WorkingHours;
import com.byootify.booking_ledger.exception.AppointmentNotFoundException;
import com.byootify.booking_ledger.exception.ConflictException;
import com.byootify.booking_ledger.exception.OutsideWorkingHoursException;
import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.LedgerEntry;
import com.byootify.booking_ledger.ledger.LedgerService;
import com.byootify.booking_ledger.outbox.OutboxEvent;
import com.byootify.booking_ledger.outbox.OutboxService;
import com.byootify.booking_ledger.settlement.ClientSettlement;
import com.byootify.booking_ledger.settlement.ClientSettlementService;
import com.byootify.booking_ledger.settlement.SettlementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end booking lifecycle against the sandbox processor.
 *
 * Prices are 100.00 USD with the default rates: 25.00 hold, 10.00 service fee, 15.00 commission.
 */
class BookingServiceTest extends AbstractIntegrationTest {

    private static final long PRICE = 10_000;

    @Autowired
    private BookingService bookingService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private CalendarService calendarService;

    @Autowired
    private ClientSettlementService settlementService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private BookingAuditRepository auditRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID clientId;
    private UUID providerId;

    @BeforeEach
    void setUp() {
        clientId = UUID.randomUUID();
        providerId = UUID.randomUUID();
    }

    private AppointmentDetails book(TimeInterval interval) {
        return book(interval, "pm_card_visa", UUID.randomUUID().toString());
    }

    private AppointmentDetails book(TimeInterval interval, String paymentMethod, String idempotencyKey) {
        return bookingService.request(new BookingRequest(clientId, providerId, interval, PRICE, CurrencyCode.USD,
                paymentMethod), idempotencyKey);
    }

    /** A window that has already started, so it can be completed. */
    private static TimeInterval inProgress() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        return TimeInterval.of(now.minus(Duration.ofMinutes(30)), Duration.ofHours(1));
    }

    private static TimeInterval startingIn(Duration lead) {
        Instant start = Instant.now().plus(lead).truncatedTo(ChronoUnit.SECONDS);
        return TimeInterval.of(start, Duration.ofHours(1));
    }

    private long providerBalance() {
        return ledgerService.balanceFor(providerId, CurrencyCode.USD, Instant.now().plusSeconds(60));
    }

    private static long amountOf(List<LedgerEntry> entries, EntryKind kind) {
        return entries.stream().filter(e -> e.getKind() == kind).mapToLong(LedgerEntry::getAmount).sum();
    }

    @Nested
    @DisplayName("Booking requests")
    class Requests {

        @Test
        @DisplayName("A request is confirmed with the hold captured and recorded")
        void requestConfirmsAppointment() {
            AppointmentDetails details = book(startingIn(Duration.ofDays(3)));
            Appointment appointment = details.getAppointment();

            assertFalse(details.isReplayed());
            assertEquals(AppointmentStatus.CONFIRMED, appointment.getStatus());
            assertEquals(2_500, appointment.getHoldAmount());
            assertNotNull(appointment.getHoldToken());
            assertNotNull(appointment.getFeeSchedule());
            assertEquals(LedgerStatus.RECORDED, details.latestLedgerStatus());

            List<LedgerEntry> entries = ledgerService.entriesFor(appointment.getId());
            assertEquals(1, entries.size());
            assertEquals(EntryKind.RESERVATION_HOLD, entries.get(0).getKind());
            assertEquals(2_500, entries.get(0).getAmount());
            assertEquals(0, providerBalance(), "Escrowed hold is not provider money");

            List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxService.APPOINTMENT_AGGREGATE,
                    appointment.getId());
            assertEquals(1, events.size());
            assertEquals("AppointmentConfirmed", events.get(0).getEventType());
        }

        @Test
        @DisplayName("Retrying with the same idempotency key returns the original appointment")
        void sameKeyReplays() {
            TimeInterval slot = startingIn(Duration.ofDays(3));
            AppointmentDetails first = book(slot, "pm_card_visa", "key-1");
            AppointmentDetails second = book(slot, "pm_card_visa", "key-1");

            assertTrue(second.isReplayed());
            assertEquals(first.getAppointment().getId(), second.getAppointment().getId());
            assertEquals(1, appointmentRepository.findByProviderIdOrderByStartAtAsc(providerId).size());
            assertEquals(1, ledgerService.entriesFor(first.getAppointment().getId()).size());
        }

        @Test
        @DisplayName("A second booking of an occupied window is refused")
        void overlappingRequestConflicts() {
            TimeInterval slot = startingIn(Duration.ofDays(3));
            book(slot);

            assertThrows(ConflictException.class, () -> book(TimeInterval.of(
                    slot.getStart().plus(Duration.ofMinutes(15)), Duration.ofHours(1))));
        }

        @Test
        @DisplayName("A declined hold leaves no appointment and frees the window")
        void declinedHoldRejectsRequest() {
            TimeInterval slot = startingIn(Duration.ofDays(3));
            UUID appointmentId = IdempotencyService.appointmentIdFor(IdempotencyService.requestKey(clientId, "key-d"));

            assertThrows(PaymentDeclinedException.class, () -> book(slot, "decline_card", "key-d"));

            assertTrue(appointmentRepository.findById(appointmentId).isEmpty());
            assertTrue(calendarService.isAvailable(providerId, slot));
            List<BookingAuditEntity> audit = auditRepository.findByAppointmentId(appointmentId);
            assertEquals(1, audit.size());
            assertEquals("DECLINED", audit.get(0).getOutcome());
            assertTrue(ledgerService.entriesFor(appointmentId).isEmpty());
        }

        @Test
        @DisplayName("Two clients racing for one window: one is confirmed, the other gets a conflict")
        void racingClientsAdmitOne() throws InterruptedException {
            TimeInterval slot = startingIn(Duration.ofDays(4));
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<AppointmentDetails>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                UUID client = UUID.randomUUID();
                results.add(executor.submit(() -> {
                    startLatch.await();
                    return bookingService.request(new BookingRequest(client, providerId, slot, PRICE,
                            CurrencyCode.USD, "pm_card_visa"), UUID.randomUUID().toString());
                }));
            }

            startLatch.countDown();
            int confirmed = 0;
            int conflicts = 0;
            for (Future<AppointmentDetails> result : results) {
                try {
                    AppointmentDetails details = result.get(30, TimeUnit.SECONDS);
                    assertEquals(AppointmentStatus.CONFIRMED, details.getAppointment().getStatus());
                    confirmed++;
                } catch (ExecutionException e) {
                    assertInstanceOf(ConflictException.class, e.getCause());
                    conflicts++;
                } catch (TimeoutException e) {
                    fail("Booking request did not finish: " + e.getMessage());
                }
            }
            executor.shutdown();

            assertEquals(1, confirmed);
            assertEquals(1, conflicts);
            assertEquals(1, appointmentRepository.findByProviderIdOrderByStartAtAsc(providerId).size());
            assertEquals(1, calendarService.availability(providerId, slot.getStart(), slot.getEnd()).size());
        }

        @Test
        @DisplayName("A lapsed hold is swept and the same window is booked again")
        void lapsedHoldIsSweptAndRebooked() {
            TimeInterval slot = startingIn(Duration.ofDays(4));
            UUID abandoned = UUID.randomUUID();
            calendarService.tryReserve(providerId, abandoned, slot);
            jdbcTemplate.update("UPDATE booked_intervals SET expires_at = now() - interval '1 minute' WHERE appointment_id = ?",
                    abandoned);

            assertEquals(1, calendarService.sweepExpiredHolds(providerId));
            assertTrue(calendarService.findInterval(abandoned).isEmpty());

            AppointmentDetails details = book(slot);

            assertEquals(AppointmentStatus.CONFIRMED, details.getAppointment().getStatus());
            assertEquals(slot, details.getAppointment().getInterval());
            assertFalse(calendarService.isAvailable(providerId, slot));
        }

        @Test
        @DisplayName("A window outside the provider's working hours is refused and audited")
        void outsideWorkingHoursRejected() {
            Instant monday = LocalDate.now(ZoneOffset.UTC).plusWeeks(1).with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                    .atTime(18, 0).toInstant(ZoneOffset.UTC);
            calendarService.replaceWorkingHours(providerId, List.of(new WorkingHours(DayOfWeek.MONDAY,
                    LocalTime.of(9, 0), LocalTime.of(17, 0), ZoneOffset.UTC)));
            UUID appointmentId = IdempotencyService.appointmentIdFor(IdempotencyService.requestKey(clientId, "key-h"));

            assertThrows(OutsideWorkingHoursException.class,
                    () -> book(TimeInterval.of(monday, Duration.ofHours(1)), "pm_card_visa", "key-h"));

            assertTrue(appointmentRepository.findById(appointmentId).isEmpty());
            assertEquals("OUTSIDE_HOURS", auditRepository.findByAppointmentId(appointmentId).get(0).getOutcome());
        }

        @Test
        @DisplayName("Unknown appointments are reported as not found")
        void unknownAppointment() {
            assertThrows(AppointmentNotFoundException.class, () -> bookingService.getAppointment(UUID.randomUUID()));
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        @DisplayName("Completing settles commission, service fee and the provider's share")
        void completeRecordsFees() {
            UUID id = book(inProgress()).getAppointment().getId();

            AppointmentDetails details = bookingService.complete(id, "evt-complete", 0);

            assertEquals(AppointmentStatus.COMPLETED, details.getAppointment().getStatus());
            assertEquals(LedgerStatus.RECORDED, details.latestLedgerStatus());
            List<LedgerEntry> entries = ledgerService.entriesFor(id);
            assertEquals(5, entries.size());
            assertEquals(1_000, amountOf(entries, EntryKind.SERVICE_FEE));
            assertEquals(1_500, amountOf(entries, EntryKind.COMMISSION));
            assertEquals(1_000, amountOf(entries, EntryKind.REFUND));
            assertEquals(8_500, amountOf(entries, EntryKind.SERVICE_CHARGE));
            assertEquals(8_500, providerBalance());

            assertFalse(calendarService.isAvailable(providerId, details.getAppointment().getInterval()),
                    "Completed appointments keep their window");

            List<ClientSettlement> settlements = settlementService.findForAppointment(id);
            assertEquals(3, settlements.size(), "Service fee and balance charged, hold remainder refunded");
            assertEquals(1, settlements.stream().filter(s -> s.getType() == SettlementType.REFUND).count());
        }

        @Test
        @DisplayName("Replaying the completion trigger changes nothing")
        void completionIsIdempotent() {
            UUID id = book(inProgress()).getAppointment().getId();
            bookingService.complete(id, "evt-complete", 0);

            AppointmentDetails replay = bookingService.complete(id, "evt-complete", 0);
            AppointmentDetails otherTrigger = bookingService.complete(id, "evt-complete-2", 0);

            assertTrue(replay.isReplayed());
            assertTrue(otherTrigger.isReplayed());
            assertEquals(2, otherTrigger.getHistory().size());
            assertEquals(5, ledgerService.entriesFor(id).size());
            assertEquals(8_500, providerBalance());
        }

        @Test
        @DisplayName("Tips accumulate per trigger and go to the provider")
        void tipsAfterCompletion() {
            UUID id = book(inProgress()).getAppointment().getId();
            bookingService.complete(id, "evt-complete", 500);

            bookingService.addTip(id, "tip-1", 700);
            bookingService.addTip(id, "tip-1", 700);

            assertEquals(1_200, amountOf(ledgerService.entriesFor(id), EntryKind.TIP));
            assertEquals(8_500 + 500 + 700, providerBalance());
        }

        @Test
        @DisplayName("Tips are refused before completion")
        void tipBeforeCompletionRejected() {
            UUID id = book(inProgress()).getAppointment().getId();

            assertThrows(IllegalStateException.class, () -> bookingService.addTip(id, "tip-1", 700));
        }

        @Test
        @DisplayName("A future appointment cannot be completed yet")
        void completeBeforeStartRejected() {
            UUID id = book(startingIn(Duration.ofDays(2))).getAppointment().getId();

            assertThrows(IllegalStateException.class, () -> bookingService.complete(id, "evt-early", 0));
            assertEquals(AppointmentStatus.CONFIRMED, bookingService.getAppointment(id).getAppointment().getStatus());
        }
    }

    @Nested
    @DisplayName("Cancellation and no-show")
    class Cancellation {

        @Test
        @DisplayName("Client cancelling at short notice pays the cancellation fee to the provider")
        void clientShortNoticeCancellation() {
            UUID id = book(startingIn(Duration.ofHours(2))).getAppointment().getId();

            AppointmentDetails details = bookingService.cancel(id, "evt-cancel", CancellationParty.CLIENT);

            assertEquals(AppointmentStatus.CANCELLED, details.getAppointment().getStatus());
            assertEquals(CancellationParty.CLIENT, details.getAppointment().getCancelledBy());
            assertTrue(details.getHistory().get(details.getHistory().size() - 1).isShortNotice());
            List<LedgerEntry> entries = ledgerService.entriesFor(id);
            assertEquals(1_500, amountOf(entries, EntryKind.CANCELLATION_FEE));
            assertEquals(1_000, amountOf(entries, EntryKind.REFUND));
            assertEquals(1_500, providerBalance());
            assertTrue(calendarService.isAvailable(providerId, details.getAppointment().getInterval()));
        }

        @Test
        @DisplayName("Client cancelling well ahead is refunded in full")
        void clientEarlyCancellation() {
            UUID id = book(startingIn(Duration.ofDays(3))).getAppointment().getId();

            bookingService.cancel(id, "evt-cancel", CancellationParty.CLIENT);

            List<LedgerEntry> entries = ledgerService.entriesFor(id);
            assertEquals(0, amountOf(entries, EntryKind.CANCELLATION_FEE));
            assertEquals(2_500, amountOf(entries, EntryKind.REFUND));
            assertEquals(0, providerBalance());
        }

        @Test
        @DisplayName("Provider cancelling refunds the client in full")
        void providerCancellation() {
            UUID id = book(startingIn(Duration.ofHours(2))).getAppointment().getId();

            bookingService.cancel(id, "evt-cancel", CancellationParty.PROVIDER);

            assertEquals(2_500, amountOf(ledgerService.entriesFor(id), EntryKind.REFUND));
            assertEquals(0, providerBalance());
        }

        @Test
        @DisplayName("A no-show forfeits the hold to the provider")
        void noShowForfeitsHold() {
            Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
            UUID id = book(TimeInterval.of(now.minus(Duration.ofHours(2)), Duration.ofHours(1)))
                    .getAppointment().getId();

            AppointmentDetails details = bookingService.markNoShow(id, "evt-no-show");

            assertEquals(AppointmentStatus.NO_SHOW, details.getAppointment().getStatus());
            assertEquals(2_500, amountOf(ledgerService.entriesFor(id), EntryKind.CANCELLATION_FEE));
            assertEquals(0, amountOf(ledgerService.entriesFor(id), EntryKind.REFUND));
            assertEquals(2_500, providerBalance());
        }

        @Test
        @DisplayName("Terminal appointments cannot change state again")
        void terminalStateIsFinal() {
            UUID id = book(inProgress()).getAppointment().getId();
            bookingService.complete(id, "evt-complete", 0);

            assertThrows(IllegalStateException.class,
                    () -> bookingService.cancel(id, "evt-cancel", CancellationParty.CLIENT));
            assertEquals(5, ledgerService.entriesFor(id).size());
        }
    }
}

package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.calendar.CalendarService;
import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.fee.FeePolicyEngine;
import com.byootify.booking_ledger.fee.FeeSchedule;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.processor.PaymentProcessorClient;
import com.byootify.booking_ledger.settlement.ClientSettlementService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * A confirmation that fails after the hold was captured must give the money and the window back.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BookingServiceConfirmFailureTest {

    private static final long PRICE = 10_000;
    private static final String HOLD_TOKEN = "hold_tok_1";

    @Mock
    private CalendarService calendarService;
    @Mock
    private AppointmentTransitionService transitionService;
    @Mock
    private LedgerPostingService ledgerPostingService;
    @Mock
    private IdempotencyService idempotencyService;
    @Mock
    private FeePolicyEngine feePolicyEngine;
    @Mock
    private PaymentProcessorClient paymentProcessor;
    @Mock
    private ClientSettlementService settlementService;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private AppointmentTransitionRepository transitionRepository;
    @Mock
    private BookingAuditRepository auditRepository;
    @Mock
    private BookingMetrics bookingMetrics;

    private BookingService bookingService;
    private BookingRequest request;
    private UUID appointmentId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T10:00:00Z"), ZoneOffset.UTC);
        bookingService = new BookingService(calendarService, transitionService, ledgerPostingService,
                idempotencyService, feePolicyEngine, paymentProcessor, settlementService, appointmentRepository,
                transitionRepository, auditRepository, bookingMetrics, clock);

        UUID clientId = UUID.randomUUID();
        request = new BookingRequest(clientId, UUID.randomUUID(),
                TimeInterval.of(Instant.parse("2026-10-21T14:00:00Z"), Duration.ofHours(1)), PRICE,
                CurrencyCode.USD, "pm_card_visa");
        appointmentId = IdempotencyService.appointmentIdFor(IdempotencyService.requestKey(clientId, "key-1"));

        when(idempotencyService.findAppointment(anyString())).thenReturn(Optional.empty());
        when(feePolicyEngine.currentSchedule()).thenReturn(new FeeSchedule(new BigDecimal("0.25"),
                new BigDecimal("0.10"), new BigDecimal("0.15"), new BigDecimal("0.15")));
        when(paymentProcessor.captureHold(eq(2_500L), eq(CurrencyCode.USD), eq("pm_card_visa"), anyString()))
                .thenReturn(HOLD_TOKEN);
        when(transitionService.confirm(any(), eq(HOLD_TOKEN), eq(2_500L), any(), anyString()))
                .thenThrow(new QueryTimeoutException("statement timeout"));
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Database failure during confirm refunds the hold, releases the window and audits")
    void confirmFailureUnwinds() {
        QueryTimeoutException e = assertThrows(QueryTimeoutException.class,
                () -> bookingService.request(request, "key-1"));
        assertEquals("statement timeout", e.getMessage());

        verify(calendarService).release(request.getProviderId(), appointmentId);
        verify(settlementService).scheduleHoldRefund(appointmentId, HOLD_TOKEN, 2_500L, CurrencyCode.USD);

        ArgumentCaptor<BookingAuditEntity> audit = ArgumentCaptor.forClass(BookingAuditEntity.class);
        verify(auditRepository).save(audit.capture());
        assertEquals("CONFIRM_FAILED", audit.getValue().getOutcome());

        verify(ledgerPostingService, never()).post(any());
        verify(idempotencyService, never()).store(anyString(), any());
        verify(bookingMetrics).recordBookingRequest("confirm_failed");
    }

    @Test
    @DisplayName("A failing release does not stop the refund or hide the original error")
    void releaseFailureStillRefunds() {
        when(calendarService.release(any(), any())).thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThrows(QueryTimeoutException.class, () -> bookingService.request(request, "key-1"));

        verify(settlementService).scheduleHoldRefund(appointmentId, HOLD_TOKEN, 2_500L, CurrencyCode.USD);
        verify(auditRepository).save(any(BookingAuditEntity.class));
    }

    @Test
    @DisplayName("Without a captured hold only the window is released")
    void zeroHoldOnlyReleases() {
        when(feePolicyEngine.currentSchedule()).thenReturn(new FeeSchedule(BigDecimal.ZERO,
                new BigDecimal("0.10"), new BigDecimal("0.15"), new BigDecimal("0.15")));
        when(transitionService.confirm(any(), isNull(), anyLong(), any(), anyString()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThrows(QueryTimeoutException.class, () -> bookingService.request(request, "key-1"));

        verify(paymentProcessor, never()).captureHold(anyLong(), any(), anyString(), anyString());
        verify(calendarService).release(request.getProviderId(), appointmentId);
        verify(settlementService, never()).scheduleHoldRefund(any(), any(), anyLong(), any());
    }
}

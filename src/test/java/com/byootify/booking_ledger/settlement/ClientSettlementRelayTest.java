package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.exception.ProcessorUnavailableException;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.processor.PaymentProcessorClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ClientSettlementRelayTest {

    @Mock
    private ClientSettlementService settlementService;

    @Mock
    private PaymentProcessorClient processorClient;

    private ClientSettlementRelay relay;

    @BeforeEach
    void setUp() {
        relay = new ClientSettlementRelay(settlementService, processorClient, new BookingMetrics(new SimpleMeterRegistry()));
        ReflectionTestUtils.setField(relay, "batchSize", 50);
    }

    private static ClientSettlement pending(SettlementType type, long amount) {
        return new ClientSettlement(UUID.randomUUID(), UUID.randomUUID(), "key-" + UUID.randomUUID(), type, amount,
                CurrencyCode.USD, "hold_123", "pm_card_visa", SettlementStatus.PENDING, 0, null, null);
    }

    @Test
    @DisplayName("Refunds go against the hold token and charges against the payment method, keyed by instruction")
    void sendsRefundsAndCharges() {
        ClientSettlement refund = pending(SettlementType.REFUND, 1_000);
        ClientSettlement charge = pending(SettlementType.CHARGE, 9_500);
        when(settlementService.findPending(50)).thenReturn(List.of(refund, charge));
        when(processorClient.refund("hold_123", 1_000, CurrencyCode.USD, refund.getInstructionKey())).thenReturn("re_1");
        when(processorClient.charge("pm_card_visa", 9_500, CurrencyCode.USD, charge.getInstructionKey())).thenReturn("ch_1");

        assertEquals(2, relay.relayOnce());

        verify(settlementService).markSent(refund.getId(), "re_1");
        verify(settlementService).markSent(charge.getId(), "ch_1");
    }

    @Test
    @DisplayName("A declined charge fails permanently")
    void declinedChargeFails() {
        ClientSettlement charge = pending(SettlementType.CHARGE, 9_500);
        when(settlementService.findPending(50)).thenReturn(List.of(charge));
        when(processorClient.charge(anyString(), eq(9_500L), eq(CurrencyCode.USD), anyString()))
                .thenThrow(new PaymentDeclinedException("card expired"));

        assertEquals(0, relay.relayOnce());

        verify(settlementService).markFailed(charge.getId(), "Payment declined: card expired");
        verify(settlementService, never()).markAttemptFailed(eq(charge.getId()), anyString());
    }

    @Test
    @DisplayName("An unavailable processor counts an attempt and leaves the instruction for the next pass")
    void unavailableProcessorCountsAttempt() {
        ClientSettlement refund = pending(SettlementType.REFUND, 1_000);
        when(settlementService.findPending(50)).thenReturn(List.of(refund));
        when(processorClient.refund(anyString(), eq(1_000L), eq(CurrencyCode.USD), anyString()))
                .thenThrow(new ProcessorUnavailableException("timeout", new IOException("read timed out")));

        assertEquals(0, relay.relayOnce());

        verify(settlementService).markAttemptFailed(refund.getId(), "timeout");
        verify(settlementService, never()).markSent(eq(refund.getId()), anyString());
    }

    @Test
    @DisplayName("The scheduled loop never throws")
    void loopSwallowsLookupFailure() {
        when(settlementService.findPending(50)).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> relay.relayPending());
    }
}

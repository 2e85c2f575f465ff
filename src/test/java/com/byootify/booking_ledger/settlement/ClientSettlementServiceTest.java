package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.LedgerAccount;
import com.byootify.booking_ledger.ledger.LedgerEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ClientSettlementServiceTest {

    @Mock
    private ClientSettlementRepository repository;

    @InjectMocks
    private ClientSettlementService settlementService;

    private static LedgerEntry entry(UUID appointmentId, EntryKind kind, LedgerAccount from, LedgerAccount to,
                                     long amount) {
        return new LedgerEntry(UUID.randomUUID(), appointmentId, UUID.randomUUID(), UUID.randomUUID(), null, kind,
                from, to, amount, CurrencyCode.USD, "complete", Instant.now(), Instant.now(),
                kind.name() + "-" + UUID.randomUUID(), 1L);
    }

    @Test
    @DisplayName("A low hold's completion charges the top-up and the balance, and leaves escrow moves alone")
    void topUpBecomesCharge() {
        UUID appointmentId = UUID.randomUUID();
        when(repository.existsByInstructionKey(anyString())).thenReturn(false);
        List<LedgerEntry> completion = List.of(
                entry(appointmentId, EntryKind.SERVICE_FEE, LedgerAccount.CLIENT, LedgerAccount.PLATFORM, 1_000),
                entry(appointmentId, EntryKind.HOLD_TOP_UP, LedgerAccount.CLIENT, LedgerAccount.ESCROW, 500),
                entry(appointmentId, EntryKind.COMMISSION, LedgerAccount.ESCROW, LedgerAccount.PLATFORM, 1_500),
                entry(appointmentId, EntryKind.SERVICE_CHARGE, LedgerAccount.CLIENT, LedgerAccount.PROVIDER, 8_500));

        int written = settlementService.recordInstructions(appointmentId, "hold_1", "pm_card_visa", completion);

        assertEquals(3, written);
        ArgumentCaptor<ClientSettlementEntity> saved = ArgumentCaptor.forClass(ClientSettlementEntity.class);
        verify(repository, times(3)).save(saved.capture());
        assertTrue(saved.getAllValues().stream().allMatch(s -> s.getType() == SettlementType.CHARGE));
        assertEquals(List.of(1_000L, 500L, 8_500L),
                saved.getAllValues().stream().map(ClientSettlementEntity::getAmount).toList());
    }

    @Test
    @DisplayName("The captured hold itself is never charged again")
    void holdIsNotCharged() {
        UUID appointmentId = UUID.randomUUID();
        when(repository.existsByInstructionKey(anyString())).thenReturn(false);

        int written = settlementService.recordInstructions(appointmentId, "hold_1", "pm_card_visa", List.of(
                entry(appointmentId, EntryKind.RESERVATION_HOLD, LedgerAccount.CLIENT, LedgerAccount.ESCROW, 2_500)));

        assertEquals(0, written);
        verify(repository, never()).save(any());
    }
}

package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.IdempotencyKeys;
import com.byootify.booking_ledger.ledger.LedgerAccount;
import com.byootify.booking_ledger.ledger.LedgerEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Derives client-side processor instructions from ledger entries.
 *
 * Money leaving escrow for the client becomes a REFUND against the captured hold; money the
 * client owes beyond the hold (service fee, balance of the price, tips, a hold top-up) becomes a
 * CHARGE. The hold itself was captured at booking, and escrow-internal movements (commission,
 * cancellation fee) need no processor call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientSettlementService {

    private final ClientSettlementRepository repository;

    @Value("${booking.settlement.max-attempts:5}")
    private int maxAttempts;

    /**
     * Records instructions for the given entries within the caller's transaction.
     * Entries that already have an instruction are skipped.
     *
     * @return number of instructions written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int recordInstructions(UUID appointmentId, String holdToken, String paymentMethod,
                                  List<LedgerEntry> entries) {
        int written = 0;
        for (LedgerEntry entry : entries) {
            if (repository.existsByInstructionKey(entry.getIdempotencyKey())) {
                continue;
            }
            if (entry.getToAccount() == LedgerAccount.CLIENT && entry.getFromAccount() == LedgerAccount.ESCROW) {
                repository.save(ClientSettlementEntity.refund(appointmentId, entry.getIdempotencyKey(),
                        entry.getAmount(), entry.getCurrency(), holdToken));
                written++;
            } else if (entry.getFromAccount() == LedgerAccount.CLIENT && entry.getKind() != EntryKind.RESERVATION_HOLD) {
                repository.save(ClientSettlementEntity.charge(appointmentId, entry.getIdempotencyKey(),
                        entry.getAmount(), entry.getCurrency(), paymentMethod));
                written++;
            }
        }
        if (written > 0) {
            log.debug("Recorded {} client settlement instructions for appointment {}", written, appointmentId);
        }
        return written;
    }

    /**
     * Schedules a full refund of a hold captured for a request that never got confirmed.
     */
    @Transactional
    public void scheduleHoldRefund(UUID appointmentId, String holdToken, long amount, CurrencyCode currency) {
        String key = IdempotencyKeys.sha256(appointmentId + "|UNCONFIRMED_HOLD_REFUND");
        if (amount <= 0 || repository.existsByInstructionKey(key)) {
            return;
        }
        repository.save(ClientSettlementEntity.refund(appointmentId, key, amount, currency, holdToken));
        log.info("Scheduled refund of unconfirmed hold: appointmentId={}, amount={}, currency={}",
                appointmentId, amount, currency);
    }

    /**
     * Uses SELECT FOR UPDATE SKIP LOCKED to allow concurrent relays.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<ClientSettlement> findPending(int limit) {
        return repository.findPendingForUpdate(limit)
                .stream()
                .map(ClientSettlementEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markSent(UUID settlementId, String processorReference) {
        repository.findById(settlementId).ifPresent(entity -> entity.markSent(processorReference));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markAttemptFailed(UUID settlementId, String error) {
        repository.findById(settlementId).ifPresent(entity -> {
            entity.markAttemptFailed(error, maxAttempts);
            log.warn("Client settlement attempt failed: id={}, attempt={}, status={}, error={}",
                    settlementId, entity.getAttempts(), entity.getStatus(), error);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID settlementId, String error) {
        repository.findById(settlementId).ifPresent(entity -> {
            entity.markFailed(error);
            log.warn("Client settlement failed permanently: id={}, error={}", settlementId, error);
        });
    }

    @Transactional(readOnly = true)
    public List<ClientSettlement> findForAppointment(UUID appointmentId) {
        return repository.findByAppointmentIdOrderByCreatedAtAsc(appointmentId)
                .stream()
                .map(ClientSettlementEntity::toDomain)
                .toList();
    }
}

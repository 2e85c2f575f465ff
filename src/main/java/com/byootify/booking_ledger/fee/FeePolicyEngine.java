package com.byootify.booking_ledger.fee;

import com.byootify.booking_ledger.exception.InvariantViolationException;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.LedgerAccount;
import com.byootify.booking_ledger.ledger.LedgerEntryDraft;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns appointment lifecycle events into ledger entry drafts.
 *
 * The reservation hold is escrow: captured at confirmation, applied against the commission at
 * completion and against the cancellation fee otherwise. A remainder is refunded to the client;
 * a shortfall is charged to the client as a HOLD_TOP_UP into escrow. Provider net on completion
 * is {@code price - commission} plus tips.
 *
 * Pure: the result depends only on the snapshotted schedule, the price and the event. Every
 * computed set is checked before it is returned:
 * - all amounts are positive
 * - signed account deltas sum to zero
 * - escrow gains the hold on confirmation and loses exactly the hold on resolution
 */
@Component
@RequiredArgsConstructor
public class FeePolicyEngine {

    private final FeePolicyProperties properties;

    /**
     * Snapshot of the configured rates, stored on an appointment when it is confirmed.
     */
    public FeeSchedule currentSchedule() {
        return FeeSchedule.from(properties);
    }

    public List<LedgerEntryDraft> computeEntries(FeeSchedule schedule, long servicePrice,
                                                 CurrencyCode currency, FeeEvent event) {
        if (servicePrice <= 0) {
            throw new IllegalArgumentException("Service price must be positive: " + servicePrice);
        }
        if (event.getTipAmount() < 0) {
            throw new IllegalArgumentException("Tip must not be negative: " + event.getTipAmount());
        }

        long hold = schedule.holdAmount(servicePrice);
        List<LedgerEntryDraft> drafts = new ArrayList<>();

        switch (event.getType()) {
            case CONFIRMED -> add(drafts, EntryKind.RESERVATION_HOLD, LedgerAccount.CLIENT, LedgerAccount.ESCROW, hold, currency);
            case COMPLETED -> {
                long commission = schedule.commission(servicePrice);
                add(drafts, EntryKind.SERVICE_FEE, LedgerAccount.CLIENT, LedgerAccount.PLATFORM,
                        schedule.serviceFee(servicePrice), currency);
                settleHold(drafts, hold, commission, currency);
                add(drafts, EntryKind.COMMISSION, LedgerAccount.ESCROW, LedgerAccount.PLATFORM, commission, currency);
                add(drafts, EntryKind.SERVICE_CHARGE, LedgerAccount.CLIENT, LedgerAccount.PROVIDER,
                        servicePrice - commission, currency);
                add(drafts, EntryKind.TIP, LedgerAccount.CLIENT, LedgerAccount.PROVIDER, event.getTipAmount(), currency);
            }
            case CANCELLED -> {
                long fee = event.chargesCancellationFee() ? schedule.cancellationFee(servicePrice) : 0;
                settleHold(drafts, hold, fee, currency);
                add(drafts, EntryKind.CANCELLATION_FEE, LedgerAccount.ESCROW, LedgerAccount.PROVIDER, fee, currency);
            }
            // The client forfeits the whole hold: the fee plus the remainder that would have been refunded.
            case NO_SHOW -> add(drafts, EntryKind.CANCELLATION_FEE, LedgerAccount.ESCROW, LedgerAccount.PROVIDER, hold, currency);
            case TIP -> {
                if (event.getTipAmount() <= 0) {
                    throw new IllegalArgumentException("Tip must be positive: " + event.getTipAmount());
                }
                add(drafts, EntryKind.TIP, LedgerAccount.CLIENT, LedgerAccount.PROVIDER, event.getTipAmount(), currency);
            }
        }

        verify(drafts, event.getType(), hold);
        return List.copyOf(drafts);
    }

    /**
     * Reconciles the escrowed hold against what the platform or provider retains from it:
     * the remainder goes back to the client, a shortfall is topped up from the client.
     */
    private static void settleHold(List<LedgerEntryDraft> drafts, long hold, long retained, CurrencyCode currency) {
        if (retained > hold) {
            add(drafts, EntryKind.HOLD_TOP_UP, LedgerAccount.CLIENT, LedgerAccount.ESCROW, retained - hold, currency);
        } else {
            add(drafts, EntryKind.REFUND, LedgerAccount.ESCROW, LedgerAccount.CLIENT, hold - retained, currency);
        }
    }

    private static void add(List<LedgerEntryDraft> drafts, EntryKind kind, LedgerAccount from,
                            LedgerAccount to, long amount, CurrencyCode currency) {
        if (amount < 0) {
            throw new InvariantViolationException(String.format(
                "Computed negative %s amount %d; schedule rates are inconsistent", kind, amount));
        }
        if (amount > 0) {
            drafts.add(LedgerEntryDraft.of(kind, from, to, amount, currency));
        }
    }

    private static void verify(List<LedgerEntryDraft> drafts, FeeEventType type, long hold) {
        Map<LedgerAccount, Long> deltas = new EnumMap<>(LedgerAccount.class);
        for (LedgerEntryDraft draft : drafts) {
            if (draft.getAmount() <= 0) {
                throw new InvariantViolationException("Non-positive ledger amount for " + draft.getKind());
            }
            if (draft.getFrom() == draft.getTo()) {
                throw new InvariantViolationException("Entry " + draft.getKind() + " moves money to its own account");
            }
            for (LedgerAccount account : LedgerAccount.values()) {
                deltas.merge(account, draft.deltaFor(account), Long::sum);
            }
        }

        long total = deltas.values().stream().mapToLong(Long::longValue).sum();
        if (total != 0) {
            throw new InvariantViolationException("Entries for " + type + " do not balance: " + deltas);
        }

        long expectedEscrow = switch (type) {
            case CONFIRMED -> hold;
            case COMPLETED, CANCELLED, NO_SHOW -> -hold;
            case TIP -> 0;
        };
        long escrow = deltas.getOrDefault(LedgerAccount.ESCROW, 0L);
        if (escrow != expectedEscrow) {
            throw new InvariantViolationException(String.format(
                "Escrow moved %d on %s, expected %d", escrow, type, expectedEscrow));
        }
    }
}

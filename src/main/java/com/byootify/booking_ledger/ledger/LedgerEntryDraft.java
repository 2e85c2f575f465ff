package com.byootify.booking_ledger.ledger;

import lombok.Value;

/**
 * An entry computed but not yet recorded: kind, direction and amount only.
 */
@Value
public class LedgerEntryDraft {
    EntryKind kind;
    LedgerAccount from;
    LedgerAccount to;
    long amount;
    CurrencyCode currency;

    public static LedgerEntryDraft of(EntryKind kind, LedgerAccount from, LedgerAccount to,
                                      long amount, CurrencyCode currency) {
        return new LedgerEntryDraft(kind, from, to, amount, currency);
    }

    /**
     * Signed effect of this entry on {@code account}: credit positive, debit negative.
     */
    public long deltaFor(LedgerAccount account) {
        long delta = 0;
        if (to == account) {
            delta += amount;
        }
        if (from == account) {
            delta -= amount;
        }
        return delta;
    }
}

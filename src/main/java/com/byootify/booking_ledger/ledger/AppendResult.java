package com.byootify.booking_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * Outcome of {@link LedgerService#append}. When {@code applied} is false the batch had been
 * recorded before and {@code entries} are the prior rows.
 */
@Value
public class AppendResult {
    boolean applied;
    List<LedgerEntry> entries;
}

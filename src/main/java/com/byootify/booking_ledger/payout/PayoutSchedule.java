package com.byootify.booking_ledger.payout;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * How often, and from which balance upwards, a provider wants to be paid.
 *
 * {@code payoutDay} is the ISO day of week for WEEKLY schedules and the day of month for
 * MONTHLY ones; a MONTHLY day past the end of a short month falls on its last day.
 * Providers without a schedule are paid every cycle above the global minimum.
 */
@Value
public class PayoutSchedule {
    UUID providerId;
    PayoutFrequency frequency;
    long minimumAmount;
    int payoutDay;
    boolean active;
    Instant updatedAt;

    /**
     * Whether a cycle whose cutoff falls on {@code cycleDate} pays this provider.
     */
    public boolean isDue(LocalDate cycleDate) {
        if (!active) {
            return false;
        }
        return switch (frequency) {
            case DAILY -> true;
            case WEEKLY -> cycleDate.getDayOfWeek().getValue() == payoutDay;
            case MONTHLY -> cycleDate.getDayOfMonth() == Math.min(payoutDay, cycleDate.lengthOfMonth());
        };
    }

    public boolean accepts(long balance) {
        return balance >= minimumAmount;
    }
}

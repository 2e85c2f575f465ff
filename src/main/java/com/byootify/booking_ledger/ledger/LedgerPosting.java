package com.byootify.booking_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A batch of drafts recorded together for one trigger event.
 *
 * The subject is the appointment for booking entries and the payout for payout entries;
 * appends are serialized per subject.
 */
@Value
public class LedgerPosting {
    UUID appointmentId;
    UUID payoutId;
    UUID providerId;
    UUID clientId;
    String triggerEventId;
    Instant effectiveAt;
    List<LedgerEntryDraft> drafts;

    public static LedgerPosting forAppointment(UUID appointmentId, UUID providerId, UUID clientId,
                                               String triggerEventId, Instant effectiveAt,
                                               List<LedgerEntryDraft> drafts) {
        return new LedgerPosting(appointmentId, null, providerId, clientId, triggerEventId, effectiveAt,
                List.copyOf(drafts));
    }

    public static LedgerPosting forPayout(UUID payoutId, UUID providerId, String triggerEventId,
                                          Instant effectiveAt, List<LedgerEntryDraft> drafts) {
        return new LedgerPosting(null, payoutId, providerId, null, triggerEventId, effectiveAt,
                List.copyOf(drafts));
    }

    public UUID subjectId() {
        return appointmentId != null ? appointmentId : payoutId;
    }
}

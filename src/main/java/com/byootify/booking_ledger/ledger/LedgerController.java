package com.byootify.booking_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only views of the ledger: entries per appointment and derived provider balances.
 */
@RestController
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;
    private final Clock clock;

    @GetMapping("/api/appointments/{appointmentId}/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> appointmentLedger(
            @PathVariable("appointmentId") UUID appointmentId) {
        List<LedgerEntryResponse> entries = ledgerService.entriesFor(appointmentId)
            .stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/api/providers/{providerId}/balance")
    public ResponseEntity<BalanceResponse> providerBalance(
            @PathVariable("providerId") UUID providerId,
            @RequestParam(value = "upto", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant upto) {
        Instant asOf = upto != null ? upto : clock.instant();
        List<BalanceLine> lines = ledgerService.balancesFor(providerId, asOf)
            .stream()
            .map(balance -> new BalanceLine(balance.getCurrency(), balance.getAmount()))
            .toList();
        return ResponseEntity.ok(new BalanceResponse(providerId, asOf, lines));
    }

    @Value
    public static class LedgerEntryResponse {
        UUID id;
        EntryKind kind;
        @JsonProperty("from_account")
        LedgerAccount fromAccount;
        @JsonProperty("to_account")
        LedgerAccount toAccount;
        @JsonProperty("amount_minor")
        long amount;
        CurrencyCode currency;
        @JsonProperty("trigger_event_id")
        String triggerEventId;
        @JsonProperty("effective_at")
        Instant effectiveAt;

        static LedgerEntryResponse from(LedgerEntry entry) {
            return new LedgerEntryResponse(entry.getId(), entry.getKind(), entry.getFromAccount(),
                    entry.getToAccount(), entry.getAmount(), entry.getCurrency(),
                    entry.getTriggerEventId(), entry.getEffectiveAt());
        }
    }

    @Value
    public static class BalanceResponse {
        @JsonProperty("provider_id")
        UUID providerId;
        @JsonProperty("as_of")
        Instant asOf;
        List<BalanceLine> balances;
    }

    @Value
    public static class BalanceLine {
        CurrencyCode currency;
        @JsonProperty("amount_minor")
        long amount;
    }
}

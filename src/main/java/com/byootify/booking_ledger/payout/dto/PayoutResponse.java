package com.byootify.booking_ledger.payout.dto;

import com.byootify.booking_ledger.payout.Payout;
import com.byootify.booking_ledger.payout.PayoutStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("amount_minor")
    long amountMinor;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("cutoff")
    Instant cutoff;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("transfer_id")
    String transferId;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PayoutResponse from(Payout payout) {
        return PayoutResponse.builder()
            .id(payout.getId())
            .providerId(payout.getProviderId())
            .amountMinor(payout.getAmount())
            .currency(payout.getCurrency().name())
            .cutoff(payout.getCutoff())
            .status(payout.getStatus())
            .transferId(payout.getTransferId())
            .attempts(payout.getAttempts())
            .lastError(payout.getLastError())
            .createdAt(payout.getCreatedAt())
            .updatedAt(payout.getUpdatedAt())
            .build();
    }
}

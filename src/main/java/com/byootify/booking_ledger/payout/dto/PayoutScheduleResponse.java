package com.byootify.booking_ledger.payout.dto;

import com.byootify.booking_ledger.payout.PayoutFrequency;
import com.byootify.booking_ledger.payout.PayoutSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutScheduleResponse {

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("frequency")
    PayoutFrequency frequency;

    @JsonProperty("minimum_amount_minor")
    long minimumAmountMinor;

    @JsonProperty("payout_day")
    int payoutDay;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PayoutScheduleResponse from(PayoutSchedule schedule) {
        return PayoutScheduleResponse.builder()
            .providerId(schedule.getProviderId())
            .frequency(schedule.getFrequency())
            .minimumAmountMinor(schedule.getMinimumAmount())
            .payoutDay(schedule.getPayoutDay())
            .active(schedule.isActive())
            .updatedAt(schedule.getUpdatedAt())
            .build();
    }
}

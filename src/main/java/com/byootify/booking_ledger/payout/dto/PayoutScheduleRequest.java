package com.byootify.booking_ledger.payout.dto;

import com.byootify.booking_ledger.payout.PayoutFrequency;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PayoutScheduleRequest {

    /** Minimum applied when the request leaves it out, in minor units. */
    public static final long DEFAULT_MINIMUM_AMOUNT = 2_500;

    @NotNull(message = "Payout frequency is required")
    @JsonProperty("frequency")
    PayoutFrequency frequency;

    @Min(value = 1, message = "Minimum amount must be positive")
    @JsonProperty("minimum_amount_minor")
    Long minimumAmountMinor;

    @Min(value = 1, message = "Payout day starts at 1")
    @Max(value = 31, message = "Payout day is at most 31")
    @JsonProperty("payout_day")
    Integer payoutDay;

    @JsonProperty("active")
    Boolean active;

    public long minimumAmountOrDefault() {
        return minimumAmountMinor != null ? minimumAmountMinor : DEFAULT_MINIMUM_AMOUNT;
    }

    public int payoutDayOrDefault() {
        return payoutDay != null ? payoutDay : 1;
    }

    public boolean activeOrDefault() {
        return active == null || active;
    }
}

package com.byootify.booking_ledger.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class TipRequest {

    @NotBlank(message = "Trigger event ID is required")
    @JsonProperty("trigger_event_id")
    String triggerEventId;

    @NotNull(message = "Tip amount is required")
    @Positive(message = "Tip must be greater than 0")
    @JsonProperty("amount_minor")
    Long amountMinor;
}

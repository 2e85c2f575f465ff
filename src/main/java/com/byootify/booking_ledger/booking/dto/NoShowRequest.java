package com.byootify.booking_ledger.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class NoShowRequest {

    @NotBlank(message = "Trigger event ID is required")
    @JsonProperty("trigger_event_id")
    String triggerEventId;
}

package com.byootify.booking_ledger.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Provider or client confirmation that the service took place, optionally with a tip.
 */
@Value
public class CompleteAppointmentRequest {

    @NotBlank(message = "Trigger event ID is required")
    @JsonProperty("trigger_event_id")
    String triggerEventId;

    @PositiveOrZero(message = "Tip must not be negative")
    @JsonProperty("tip_minor")
    Long tipMinor;

    public long tipOrZero() {
        return tipMinor == null ? 0 : tipMinor;
    }
}

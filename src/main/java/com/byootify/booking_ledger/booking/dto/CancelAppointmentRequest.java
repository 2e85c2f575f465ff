package com.byootify.booking_ledger.booking.dto;

import com.byootify.booking_ledger.fee.CancellationParty;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class CancelAppointmentRequest {

    @NotBlank(message = "Trigger event ID is required")
    @JsonProperty("trigger_event_id")
    String triggerEventId;

    @NotNull(message = "Cancelling party is required")
    @JsonProperty("cancelled_by")
    CancellationParty cancelledBy;
}

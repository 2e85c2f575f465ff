package com.byootify.booking_ledger.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CreateAppointmentRequest {

    @NotNull(message = "Client ID is required")
    @JsonProperty("client_id")
    UUID clientId;

    @NotNull(message = "Provider ID is required")
    @JsonProperty("provider_id")
    UUID providerId;

    @NotNull(message = "Start is required")
    @JsonProperty("start")
    Instant start;

    @NotNull(message = "End is required")
    @JsonProperty("end")
    Instant end;

    @NotNull(message = "Service price is required")
    @Positive(message = "Service price must be greater than 0")
    @JsonProperty("service_price_minor")
    Long servicePriceMinor;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Payment method is required")
    @JsonProperty("payment_method")
    String paymentMethod;
}

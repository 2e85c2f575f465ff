package com.byootify.booking_ledger.booking.dto;

import com.byootify.booking_ledger.booking.Appointment;
import com.byootify.booking_ledger.booking.AppointmentDetails;
import com.byootify.booking_ledger.booking.AppointmentStatus;
import com.byootify.booking_ledger.booking.AppointmentTransition;
import com.byootify.booking_ledger.booking.LedgerStatus;
import com.byootify.booking_ledger.booking.TransitionType;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Appointment with its state history. {@code ledger_status} reflects the latest transition;
 * DEGRADED means the money movements are still being retried.
 */
@Value
@Builder
public class AppointmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("start")
    Instant start;

    @JsonProperty("end")
    Instant end;

    @JsonProperty("service_price_minor")
    long servicePriceMinor;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    AppointmentStatus status;

    @JsonProperty("hold_amount_minor")
    long holdAmountMinor;

    @JsonProperty("cancelled_by")
    CancellationParty cancelledBy;

    @JsonProperty("ledger_status")
    LedgerStatus ledgerStatus;

    @JsonProperty("history")
    List<TransitionView> history;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AppointmentResponse from(AppointmentDetails details) {
        Appointment appointment = details.getAppointment();
        return AppointmentResponse.builder()
            .id(appointment.getId())
            .clientId(appointment.getClientId())
            .providerId(appointment.getProviderId())
            .start(appointment.getInterval().getStart())
            .end(appointment.getInterval().getEnd())
            .servicePriceMinor(appointment.getServicePrice())
            .currency(appointment.getCurrency().name())
            .status(appointment.getStatus())
            .holdAmountMinor(appointment.getHoldAmount())
            .cancelledBy(appointment.getCancelledBy())
            .ledgerStatus(details.latestLedgerStatus())
            .history(details.getHistory().stream().map(TransitionView::from).toList())
            .createdAt(appointment.getCreatedAt())
            .updatedAt(appointment.getUpdatedAt())
            .build();
    }

    @Value
    public static class TransitionView {

        @JsonProperty("type")
        TransitionType type;

        @JsonProperty("from")
        AppointmentStatus from;

        @JsonProperty("to")
        AppointmentStatus to;

        @JsonProperty("trigger_event_id")
        String triggerEventId;

        @JsonProperty("tip_minor")
        long tipMinor;

        @JsonProperty("occurred_at")
        Instant occurredAt;

        @JsonProperty("ledger_status")
        LedgerStatus ledgerStatus;

        static TransitionView from(AppointmentTransition transition) {
            return new TransitionView(transition.getType(), transition.getFromStatus(), transition.getToStatus(),
                    transition.getTriggerEventId(), transition.getTipAmount(), transition.getOccurredAt(),
                    transition.getLedgerStatus());
        }
    }
}

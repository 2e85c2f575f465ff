package com.byootify.booking_ledger.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only availability view of a provider's calendar.
 */
@RestController
@RequestMapping("/api/providers/{providerId}/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CalendarService calendarService;

    @GetMapping
    public ResponseEntity<AvailabilityResponse> availability(
            @PathVariable("providerId") UUID providerId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        List<BusyWindow> busy = calendarService.availability(providerId, from, to)
            .stream()
            .map(interval -> new BusyWindow(interval.getStart(), interval.getEnd()))
            .toList();
        return ResponseEntity.ok(new AvailabilityResponse(providerId, from, to, busy));
    }

    @Value
    public static class AvailabilityResponse {
        @JsonProperty("provider_id")
        UUID providerId;
        Instant from;
        Instant to;
        List<BusyWindow> busy;
    }

    @Value
    public static class BusyWindow {
        Instant start;
        Instant end;
    }
}

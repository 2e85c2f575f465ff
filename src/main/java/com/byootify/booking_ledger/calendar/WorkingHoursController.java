package com.byootify.booking_ledger.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Weekly working hours a provider accepts bookings in.
 *
 * A PUT replaces the whole week; an empty list lets the provider be booked at any time.
 */
@RestController
@RequestMapping("/api/providers/{providerId}/working-hours")
@RequiredArgsConstructor
public class WorkingHoursController {

    private final CalendarService calendarService;

    @GetMapping
    public ResponseEntity<List<Shift>> workingHours(@PathVariable("providerId") UUID providerId) {
        return ResponseEntity.ok(calendarService.workingHours(providerId).stream().map(Shift::from).toList());
    }

    @PutMapping
    public ResponseEntity<List<Shift>> replaceWorkingHours(@PathVariable("providerId") UUID providerId,
                                                           @RequestBody List<Shift> shifts) {
        List<WorkingHours> hours = shifts.stream().map(Shift::toDomain).toList();
        return ResponseEntity.ok(calendarService.replaceWorkingHours(providerId, hours)
            .stream()
            .map(Shift::from)
            .toList());
    }

    @Value
    public static class Shift {
        @JsonProperty("day_of_week")
        DayOfWeek dayOfWeek;
        LocalTime start;
        LocalTime end;
        ZoneId zone;

        static Shift from(WorkingHours hours) {
            return new Shift(hours.getDayOfWeek(), hours.getStart(), hours.getEnd(), hours.getZone());
        }

        WorkingHours toDomain() {
            return new WorkingHours(dayOfWeek, start, end, zone);
        }
    }
}

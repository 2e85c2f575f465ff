package com.byootify.booking_ledger.calendar;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * One weekly shift of a provider, {@code [start, end)} in local time of {@code zone}.
 */
@Value
public class WorkingHours {
    DayOfWeek dayOfWeek;
    LocalTime start;
    LocalTime end;
    ZoneId zone;

    public WorkingHours(DayOfWeek dayOfWeek, LocalTime start, LocalTime end, ZoneId zone) {
        if (dayOfWeek == null || start == null || end == null || zone == null) {
            throw new IllegalArgumentException("Working hours need a day, start, end and zone");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                String.format("Working hours end %s must be after start %s", end, start));
        }
        this.dayOfWeek = dayOfWeek;
        this.start = start;
        this.end = end;
        this.zone = zone;
    }

    /**
     * True when the whole window falls inside this shift on a single local day.
     */
    public boolean covers(TimeInterval interval) {
        ZonedDateTime from = interval.getStart().atZone(zone);
        ZonedDateTime to = interval.getEnd().atZone(zone);
        return from.getDayOfWeek() == dayOfWeek
            && from.toLocalDate().equals(to.toLocalDate())
            && !from.toLocalTime().isBefore(start)
            && !to.toLocalTime().isAfter(end);
    }
}

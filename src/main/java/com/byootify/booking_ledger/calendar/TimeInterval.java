package com.byootify.booking_ledger.calendar;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time window {@code [start, end)}.
 *
 * Two intervals overlap iff {@code a.start < b.end && b.start < a.end}, so back-to-back
 * windows (end of one equals start of the next) never conflict.
 */
@Value
public class TimeInterval {
    Instant start;
    Instant end;

    public TimeInterval(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                String.format("Interval end %s must be after start %s", end, start));
        }
        this.start = start;
        this.end = end;
    }

    public static TimeInterval of(Instant start, Instant end) {
        return new TimeInterval(start, end);
    }

    public static TimeInterval of(Instant start, Duration duration) {
        return new TimeInterval(start, start.plus(duration));
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}

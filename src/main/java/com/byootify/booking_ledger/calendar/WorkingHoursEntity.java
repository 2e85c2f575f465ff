package com.byootify.booking_ledger.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;

@Entity
@Table(
    name = "provider_working_hours",
    indexes = @Index(name = "idx_provider_working_hours_provider", columnList = "provider_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkingHoursEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    /** ISO day of week, Monday = 1. */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    static WorkingHoursEntity of(UUID providerId, WorkingHours hours) {
        return new WorkingHoursEntity(UUID.randomUUID(), providerId, hours.getDayOfWeek().getValue(),
                hours.getStart(), hours.getEnd(), hours.getZone().getId());
    }

    public WorkingHours toDomain() {
        return new WorkingHours(DayOfWeek.of(dayOfWeek), startTime, endTime, ZoneId.of(timeZone));
    }
}

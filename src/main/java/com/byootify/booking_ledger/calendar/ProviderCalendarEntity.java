package com.byootify.booking_ledger.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-provider lock row. Every calendar mutation for a provider first takes
 * {@code SELECT ... FOR UPDATE} on this row, so admissions for one provider are serialized
 * while different providers proceed independently.
 */
@Entity
@Table(name = "provider_calendars")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProviderCalendarEntity {

    @Id
    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "mutation_count", nullable = false)
    private long mutationCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    void recordMutation(Instant now) {
        this.mutationCount++;
        this.updatedAt = now;
    }
}

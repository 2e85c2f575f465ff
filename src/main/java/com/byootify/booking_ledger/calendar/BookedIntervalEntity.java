package com.byootify.booking_ledger.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a calendar interval.
 *
 * No setters: rows are created by {@link #tentative} and only ever promoted by {@link #confirm()}.
 * Overlap between rows of one provider is also rejected by an exclusion constraint.
 */
@Entity
@Table(
    name = "booked_intervals",
    indexes = {
        @Index(name = "idx_booked_intervals_provider_start", columnList = "provider_id, start_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookedIntervalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "appointment_id", nullable = false, updatable = false, unique = true)
    private UUID appointmentId;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IntervalStatus status;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static BookedIntervalEntity tentative(UUID providerId, UUID appointmentId,
                                          TimeInterval interval, Instant expiresAt) {
        return new BookedIntervalEntity(
            UUID.randomUUID(),
            providerId,
            appointmentId,
            interval.getStart(),
            interval.getEnd(),
            IntervalStatus.TENTATIVE,
            expiresAt,
            null
        );
    }

    void confirm() {
        this.status = IntervalStatus.CONFIRMED;
        this.expiresAt = null;
    }

    TimeInterval interval() {
        return TimeInterval.of(startAt, endAt);
    }

    boolean isLapsed(Instant now) {
        return status == IntervalStatus.TENTATIVE && !expiresAt.isAfter(now);
    }

    public BookedInterval toDomain() {
        return new BookedInterval(providerId, appointmentId, interval(), status, expiresAt);
    }
}

package com.byootify.booking_ledger.booking;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for a rejected booking request. The request itself is discarded.
 */
@Entity
@Table(name = "booking_audit_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookingAuditEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "appointment_id", nullable = false, updatable = false)
    private UUID appointmentId;

    @Column(name = "client_id", nullable = false, updatable = false)
    private UUID clientId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Column(nullable = false, length = 32, updatable = false)
    private String outcome;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BookingAuditEntity rejected(UUID appointmentId, BookingRequest request, String outcome,
                                       String detail, Instant now) {
        return new BookingAuditEntity(
            UUID.randomUUID(),
            appointmentId,
            request.getClientId(),
            request.getProviderId(),
            request.getInterval().getStart(),
            request.getInterval().getEnd(),
            outcome,
            detail,
            now
        );
    }
}

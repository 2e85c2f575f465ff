package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.fee.CancellationParty;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for appointment state history.
 *
 * {@code (appointment_id, trigger_event_id)} is unique, so a retried trigger can never
 * record a second transition.
 */
@Entity
@Table(
    name = "appointment_transitions",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_appointment_transitions_trigger", columnNames = {"appointment_id", "trigger_event_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AppointmentTransitionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "appointment_id", nullable = false, updatable = false)
    private UUID appointmentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private TransitionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false, length = 16, updatable = false)
    private AppointmentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 16, updatable = false)
    private AppointmentStatus toStatus;

    @Column(name = "trigger_event_id", nullable = false, updatable = false)
    private String triggerEventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 16, updatable = false)
    private CancellationParty cancelledBy;

    @Column(name = "short_notice", nullable = false, updatable = false)
    private boolean shortNotice;

    @Column(name = "tip_amount_minor", nullable = false, updatable = false)
    private long tipAmount;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_status", nullable = false, length = 16)
    private LedgerStatus ledgerStatus;

    @Column(name = "ledger_attempts", nullable = false)
    private int ledgerAttempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    static AppointmentTransitionEntity record(UUID appointmentId, TransitionType type, AppointmentStatus from,
                                              String triggerEventId, CancellationParty cancelledBy,
                                              boolean shortNotice, long tipAmount, Instant occurredAt) {
        return new AppointmentTransitionEntity(
            UUID.randomUUID(),
            appointmentId,
            type,
            from,
            type.getTarget(),
            triggerEventId,
            cancelledBy,
            shortNotice,
            tipAmount,
            occurredAt,
            LedgerStatus.PENDING,
            0,
            null
        );
    }

    void markRecorded() {
        this.ledgerStatus = LedgerStatus.RECORDED;
        this.ledgerAttempts++;
        this.lastError = null;
    }

    void markDegraded(int attempts, String error) {
        this.ledgerStatus = LedgerStatus.DEGRADED;
        this.ledgerAttempts += attempts;
        this.lastError = error;
    }

    void markHalted(String error) {
        this.ledgerStatus = LedgerStatus.HALTED;
        this.ledgerAttempts++;
        this.lastError = error;
    }

    public AppointmentTransition toDomain() {
        return new AppointmentTransition(id, appointmentId, type, fromStatus, toStatus, triggerEventId,
                cancelledBy, shortNotice, tipAmount, occurredAt, ledgerStatus, ledgerAttempts, lastError);
    }
}

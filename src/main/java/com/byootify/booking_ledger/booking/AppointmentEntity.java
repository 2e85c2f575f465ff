package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.fee.CancellationParty;
import com.byootify.booking_ledger.fee.FeeSchedule;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for appointments.
 *
 * Rows exist from confirmation onward; rejected requests leave only an audit row.
 * No setters: {@link #fromDomain} creates rows and {@link #updateFromDomain} carries
 * the mutable lifecycle fields.
 */
@Entity
@Table(
    name = "appointments",
    indexes = {
        @Index(name = "idx_appointments_request_key", columnList = "request_key"),
        @Index(name = "idx_appointments_status_end", columnList = "status, end_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AppointmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "client_id", nullable = false, updatable = false)
    private UUID clientId;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "service_price_minor", nullable = false, updatable = false)
    private long servicePrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AppointmentStatus status;

    @Column(name = "payment_method", nullable = false, updatable = false)
    private String paymentMethod;

    @Column(name = "hold_token", updatable = false)
    private String holdToken;

    @Column(name = "hold_amount_minor", nullable = false, updatable = false)
    private long holdAmount;

    @Column(name = "hold_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal holdRate;

    @Column(name = "service_fee_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal serviceFeeRate;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "cancellation_fee_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal cancellationFeeRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 16)
    private CancellationParty cancelledBy;

    @Column(name = "request_key", nullable = false, unique = true, updatable = false)
    private String requestKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AppointmentEntity fromDomain(Appointment appointment, String requestKey) {
        FeeSchedule schedule = appointment.getFeeSchedule();
        if (schedule == null) {
            throw new IllegalArgumentException("Appointment " + appointment.getId() + " has no fee schedule");
        }
        return new AppointmentEntity(
            appointment.getId(),
            appointment.getClientId(),
            appointment.getProviderId(),
            appointment.getServicePrice(),
            appointment.getCurrency(),
            appointment.getInterval().getStart(),
            appointment.getInterval().getEnd(),
            appointment.getStatus(),
            appointment.getPaymentMethod(),
            appointment.getHoldToken(),
            appointment.getHoldAmount(),
            schedule.getReservationHoldRate(),
            schedule.getServiceFeeRate(),
            schedule.getCommissionRate(),
            schedule.getCancellationFeeRate(),
            appointment.getCancelledBy(),
            requestKey,
            appointment.getCreatedAt(),
            appointment.getUpdatedAt()
        );
    }

    public Appointment toDomain() {
        return new Appointment(
            id,
            clientId,
            providerId,
            servicePrice,
            currency,
            TimeInterval.of(startAt, endAt),
            status,
            paymentMethod,
            holdToken,
            holdAmount,
            new FeeSchedule(holdRate, serviceFeeRate, commissionRate, cancellationFeeRate),
            cancelledBy,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only status and cancellation party change after confirmation.
     */
    void updateFromDomain(Appointment appointment) {
        this.status = appointment.getStatus();
        this.cancelledBy = appointment.getCancelledBy();
    }
}

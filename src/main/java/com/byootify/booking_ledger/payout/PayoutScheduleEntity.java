package com.byootify.booking_ledger.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "provider_payout_schedules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutScheduleEntity {

    @Id
    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PayoutFrequency frequency;

    @Column(name = "minimum_amount_minor", nullable = false)
    private long minimumAmount;

    @Column(name = "payout_day", nullable = false)
    private int payoutDay;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PayoutScheduleEntity create(UUID providerId, PayoutFrequency frequency, long minimumAmount,
                                       int payoutDay, boolean active) {
        PayoutScheduleEntity entity = new PayoutScheduleEntity();
        entity.providerId = providerId;
        entity.update(frequency, minimumAmount, payoutDay, active);
        return entity;
    }

    void update(PayoutFrequency frequency, long minimumAmount, int payoutDay, boolean active) {
        if (minimumAmount < 1) {
            throw new IllegalArgumentException("Payout minimum must be positive: " + minimumAmount);
        }
        int maxDay = frequency == PayoutFrequency.WEEKLY ? 7 : 31;
        if (frequency != PayoutFrequency.DAILY && (payoutDay < 1 || payoutDay > maxDay)) {
            throw new IllegalArgumentException(String.format(
                "Payout day %d is out of range 1-%d for a %s schedule", payoutDay, maxDay, frequency));
        }
        this.frequency = frequency;
        this.minimumAmount = minimumAmount;
        this.payoutDay = frequency == PayoutFrequency.DAILY ? 1 : payoutDay;
        this.active = active;
    }

    public PayoutSchedule toDomain() {
        return new PayoutSchedule(providerId, frequency, minimumAmount, payoutDay, active, updatedAt);
    }
}

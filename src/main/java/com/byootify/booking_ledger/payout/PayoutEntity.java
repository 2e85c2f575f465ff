package com.byootify.booking_ledger.payout;

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

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "payouts",
    indexes = {
        @Index(name = "idx_payouts_provider", columnList = "provider_id, cutoff"),
        @Index(name = "idx_payouts_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "provider_id", nullable = false, updatable = false)
    private UUID providerId;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false)
    private Instant cutoff;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PayoutStatus status;

    @Column(name = "transfer_id")
    private String transferId;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

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

    static PayoutEntity pending(UUID id, UUID providerId, long amount, CurrencyCode currency,
                                Instant cutoff, String idempotencyKey) {
        return new PayoutEntity(id, providerId, amount, currency, cutoff, PayoutStatus.PENDING,
                null, 0, null, idempotencyKey, null, null);
    }

    void recordTransfer(String transferId) {
        requirePending("record a transfer for");
        this.transferId = transferId;
        this.attempts++;
        this.lastError = null;
    }

    void recordAttemptFailed(String error) {
        requirePending("record a failed attempt for");
        this.attempts++;
        this.lastError = error;
    }

    void markSettled() {
        requirePending("settle");
        this.status = PayoutStatus.SETTLED;
    }

    void markReversed(String reason) {
        requirePending("reverse");
        this.status = PayoutStatus.REVERSED;
        this.lastError = reason;
    }

    private void requirePending(String action) {
        if (status != PayoutStatus.PENDING) {
            throw new IllegalStateException(String.format(
                "Cannot %s payout %s in %s status", action, id, status));
        }
    }

    public Payout toDomain() {
        return new Payout(id, providerId, amount, currency, cutoff, status, transferId, attempts,
                lastError, idempotencyKey, createdAt, updatedAt);
    }
}

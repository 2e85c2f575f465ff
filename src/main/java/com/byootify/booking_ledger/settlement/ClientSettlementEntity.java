package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A refund or charge the processor must carry out on the client's side.
 *
 * Written in the same transaction as the ledger entry it derives from, then relayed to the
 * processor in the background. The instruction key doubles as the processor idempotency key.
 */
@Entity
@Table(name = "client_settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClientSettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "appointment_id", nullable = false, updatable = false)
    private UUID appointmentId;

    @Column(name = "instruction_key", nullable = false, unique = true, updatable = false)
    private String instructionKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private SettlementType type;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "hold_token", updatable = false)
    private String holdToken;

    @Column(name = "payment_method", updatable = false)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SettlementStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "processor_reference")
    private String processorReference;

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

    static ClientSettlementEntity refund(UUID appointmentId, String instructionKey, long amount,
                                         CurrencyCode currency, String holdToken) {
        return new ClientSettlementEntity(UUID.randomUUID(), appointmentId, instructionKey, SettlementType.REFUND,
                amount, currency, holdToken, null, SettlementStatus.PENDING, 0, null, null, null, null);
    }

    static ClientSettlementEntity charge(UUID appointmentId, String instructionKey, long amount,
                                         CurrencyCode currency, String paymentMethod) {
        return new ClientSettlementEntity(UUID.randomUUID(), appointmentId, instructionKey, SettlementType.CHARGE,
                amount, currency, null, paymentMethod, SettlementStatus.PENDING, 0, null, null, null, null);
    }

    void markSent(String processorReference) {
        this.status = SettlementStatus.SENT;
        this.attempts++;
        this.processorReference = processorReference;
        this.lastError = null;
    }

    void markAttemptFailed(String error, int maxAttempts) {
        this.attempts++;
        this.lastError = error;
        if (this.attempts >= maxAttempts) {
            this.status = SettlementStatus.FAILED;
        }
    }

    void markFailed(String error) {
        this.attempts++;
        this.lastError = error;
        this.status = SettlementStatus.FAILED;
    }

    public ClientSettlement toDomain() {
        return new ClientSettlement(id, appointmentId, instructionKey, type, amount, currency, holdToken,
                paymentMethod, status, attempts, lastError, processorReference);
    }
}

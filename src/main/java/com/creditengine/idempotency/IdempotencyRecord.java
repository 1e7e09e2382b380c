package com.creditengine.idempotency;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted reservation of an idempotency key.
 *
 * A key maps to at most one resulting ledger transaction. A PENDING record
 * whose reservation is older than the pending timeout may be taken over.
 */
@Entity
@Table(name = "idempotency_records", indexes = {
    @Index(name = "idx_idempotency_user_id", columnList = "user_id")
})
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String key;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, updatable = false, length = 32)
    private IdempotentOperation operation;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "resulting_transaction_id")
    private String resultingTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Time of the latest reservation; refreshed on takeover.
     */
    @Column(name = "reserved_at", nullable = false)
    private Instant reservedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public enum Status {
        PENDING,
        COMPLETED
    }

    public IdempotencyRecord(String key, String userId, IdempotentOperation operation, Instant now) {
        this.key = key;
        this.userId = userId;
        this.operation = operation;
        this.status = Status.PENDING;
        this.createdAt = now;
        this.reservedAt = now;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public boolean isStale(Instant now, Duration pendingTimeout) {
        return status == Status.PENDING && reservedAt.plus(pendingTimeout).isBefore(now);
    }

    public void refreshReservation(Instant now) {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Cannot refresh a completed reservation: " + key);
        }
        this.reservedAt = now;
    }

    public void complete(String transactionId, Instant now) {
        if (status == Status.COMPLETED) {
            throw new IllegalStateException("Idempotency key already completed: " + key);
        }
        this.status = Status.COMPLETED;
        this.resultingTransactionId = transactionId;
        this.completedAt = now;
    }
}

package com.creditengine.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable ledger entry recording one signed change to a user's credits.
 *
 * Transactions are never updated or deleted - the ledger is append-only.
 * Corrections are recorded as new offsetting transactions.
 */
@Entity
@Table(name = "credit_transactions", indexes = {
    @Index(name = "idx_credit_tx_user_id", columnList = "user_id"),
    @Index(name = "idx_credit_tx_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_credit_tx_idempotency_key", columnList = "idempotency_key")
})
@Getter
@ToString(exclude = "metadata")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditTransaction {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 32)
    private TransactionType type;

    /**
     * Signed amount: positive for credits in, negative for credits out.
     */
    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "description", nullable = false, updatable = false)
    private String description;

    /**
     * Audit details: purchase token, referral code, admin id, streak.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "credit_transaction_metadata", joinColumns = @JoinColumn(name = "transaction_id"))
    @MapKeyColumn(name = "meta_key")
    @Column(name = "meta_value", length = 1024)
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    /**
     * Truncated to milliseconds on creation.
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public CreditTransaction(String userId, TransactionType type, long amount, String description,
                             Map<String, String> metadata, String idempotencyKey, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.type = type;
        this.amount = amount;
        this.description = description;
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        this.idempotencyKey = idempotencyKey;
        this.createdAt = createdAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String metadataValue(String key) {
        return metadata.get(key);
    }
}

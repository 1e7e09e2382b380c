package com.creditengine.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of a ledger transaction handed to callers.
 */
@Value
@Builder
public class TransactionView {
    String id;
    String userId;
    TransactionType type;
    long amount;
    String description;
    Map<String, String> metadata;
    String idempotencyKey;
    Instant createdAt;

    public static TransactionView from(CreditTransaction transaction) {
        return TransactionView.builder()
            .id(transaction.getId())
            .userId(transaction.getUserId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .description(transaction.getDescription())
            .metadata(Map.copyOf(transaction.getMetadata()))
            .idempotencyKey(transaction.getIdempotencyKey())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}

package com.creditengine.ledger;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Sort;

import java.time.Instant;

/**
 * Optional filters for listing a user's ledger history.
 */
@Value
@Builder
public class TransactionFilter {

    /**
     * Only transactions of this type, or all when null.
     */
    TransactionType type;

    /**
     * Inclusive lower bound on createdAt.
     */
    Instant from;

    /**
     * Inclusive upper bound on createdAt.
     */
    Instant to;

    @Builder.Default
    Sort.Direction direction = Sort.Direction.DESC;

    public static TransactionFilter none() {
        return TransactionFilter.builder().build();
    }
}

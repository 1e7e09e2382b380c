package com.creditengine.ledger;

import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * JPA specifications used to filter ledger history.
 */
final class TransactionSpecifications {

    private TransactionSpecifications() {
    }

    static Specification<CreditTransaction> forUser(String userId, TransactionFilter filter) {
        Specification<CreditTransaction> spec = userIs(userId);
        if (filter.getType() != null) {
            spec = spec.and(typeIs(filter.getType()));
        }
        if (filter.getFrom() != null) {
            spec = spec.and(createdAtOrAfter(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            spec = spec.and(createdAtOrBefore(filter.getTo()));
        }
        return spec;
    }

    static Specification<CreditTransaction> userIs(String userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    static Specification<CreditTransaction> typeIs(TransactionType type) {
        return (root, query, cb) -> cb.equal(root.get("type"), type);
    }

    static Specification<CreditTransaction> createdAtOrAfter(Instant from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    static Specification<CreditTransaction> createdAtOrBefore(Instant to) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), to);
    }
}

package com.creditengine.balance;

import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a user's balance returned to callers.
 */
@Value
public class BalanceView {
    String userId;
    long totalCredits;
    long lifetimeEarned;
    long lifetimeSpent;
    Instant updatedAt;

    public static BalanceView from(CreditBalance balance) {
        return new BalanceView(
            balance.getUserId(),
            balance.getTotalCredits(),
            balance.getLifetimeEarned(),
            balance.getLifetimeSpent(),
            balance.getUpdatedAt()
        );
    }
}

package com.creditengine.balance;

import java.util.List;

/**
 * Summary of a reconciliation run over every user with ledger history.
 */
public record ReconciliationSummary(
        int totalUsers,
        int balancedUsers,
        int usersWithDrift,
        long totalDrift,
        List<ReconciliationResult> driftResults
) {

    public boolean isSuccessful() {
        return usersWithDrift == 0;
    }
}

package com.creditengine.balance;

/**
 * Result of comparing a user's cached balance with the ledger fold.
 *
 * @param cachedBalance balance held in the projection before any repair
 * @param ledgerBalance sum of the user's ledger amounts
 * @param drift         cachedBalance - ledgerBalance
 * @param repaired      whether the cache was reset to the ledger value
 */
public record ReconciliationResult(
        String userId,
        long cachedBalance,
        long ledgerBalance,
        long drift,
        boolean repaired
) {

    public boolean isBalanced() {
        return drift == 0;
    }
}

package com.creditengine.orchestrator;

import com.creditengine.balance.BalanceView;
import com.creditengine.ledger.CreditTransaction;
import lombok.Value;

/**
 * Outcome of a ledger write: the transaction, and whether it was written now
 * or replayed from an earlier request with the same idempotency key.
 */
@Value
public class Posting {
    CreditTransaction transaction;

    /**
     * Balance right after the write. Null for replays.
     */
    BalanceView balance;

    boolean replayed;

    static Posting posted(CreditTransaction transaction, BalanceView balance) {
        return new Posting(transaction, balance, false);
    }

    static Posting replayed(CreditTransaction transaction) {
        return new Posting(transaction, null, true);
    }
}

package com.creditengine.purchase;

import com.creditengine.ledger.TransactionView;
import lombok.Value;

/**
 * Credits granted for a purchase. A redelivered purchase yields an equal result.
 */
@Value
public class PurchaseResult {
    long creditsGranted;
    long bonusCredits;
    TransactionView transaction;

    public long getTotalCredits() {
        return creditsGranted + bonusCredits;
    }
}

package com.creditengine.purchase;

import lombok.Builder;
import lombok.Value;

/**
 * A store purchase to redeem for credits.
 */
@Value
@Builder
public class PurchaseRequest {
    String userId;
    String productId;
    String purchaseToken;
    Platform platform;

    /**
     * Store transaction id, required. Redemptions are deduplicated on it alone.
     */
    String transactionId;

    String receiptData;

    public String receiptOrToken() {
        return receiptData != null && !receiptData.isBlank() ? receiptData : purchaseToken;
    }
}

package com.creditengine.purchase;

/**
 * Verifies store receipts before credits are granted.
 *
 * In production, this would call the platform's receipt validation:
 * - App Store Server API (iOS)
 * - Google Play Developer API (Android)
 * - the web payment provider's webhook records
 */
public interface PurchaseReceiptVerifier {

    /**
     * Check that the receipt proves a completed purchase.
     *
     * @param receipt the receipt data, or the purchase token when no receipt was sent
     * @param platform the store the purchase was made through
     * @return true if the purchase is genuine
     */
    boolean verify(String receipt, Platform platform);
}

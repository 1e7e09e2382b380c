package com.creditengine.purchase;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mock receipt verifier.
 *
 * Accepts every receipt except those starting with "invalid", which lets
 * callers exercise the rejection path without a store sandbox.
 */
@Component
@Slf4j
public class MockPurchaseReceiptVerifier implements PurchaseReceiptVerifier {

    static final String REJECTED_PREFIX = "invalid";

    @Override
    public boolean verify(String receipt, Platform platform) {
        boolean verified = receipt != null && !receipt.startsWith(REJECTED_PREFIX);
        log.debug("Mock {} receipt verification: {}", platform, verified);
        return verified;
    }
}

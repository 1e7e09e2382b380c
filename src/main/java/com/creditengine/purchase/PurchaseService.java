package com.creditengine.purchase;

import com.creditengine.common.InputLimits;
import com.creditengine.common.exception.InvalidOperationException;
import com.creditengine.common.exception.InvalidPurchaseException;
import com.creditengine.ledger.CreditTransaction;
import com.creditengine.ledger.TransactionType;
import com.creditengine.ledger.TransactionView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Product catalog lookups, receipt checks and the PURCHASE ledger entry.
 */
@Service
@Slf4j
public class PurchaseService {

    static final String META_PRODUCT_ID = "productId";
    static final String META_PLATFORM = "platform";
    static final String META_PURCHASE_TOKEN = "purchaseToken";
    static final String META_STORE_TRANSACTION_ID = "storeTransactionId";
    static final String META_BASE_CREDITS = "baseCredits";
    static final String META_BONUS_CREDITS = "bonusCredits";

    private final CreditProductRepository productRepository;
    private final PurchaseReceiptVerifier receiptVerifier;
    private final int bonusPercent;

    public PurchaseService(CreditProductRepository productRepository,
                           PurchaseReceiptVerifier receiptVerifier,
                           @Value("${credit-engine.purchase.bonus-percent:10}") int bonusPercent) {
        if (bonusPercent < 0) {
            throw new IllegalArgumentException("Purchase bonus percent cannot be negative");
        }
        this.productRepository = productRepository;
        this.receiptVerifier = receiptVerifier;
        this.bonusPercent = bonusPercent;
    }

    public void validate(PurchaseRequest request) {
        if (request == null) {
            throw new InvalidOperationException("Purchase request is required");
        }
        InputLimits.requireId(request.getUserId(), "User ID");
        InputLimits.requireId(request.getProductId(), "Product ID");
        InputLimits.requireId(request.getTransactionId(), "Transaction ID");
        InputLimits.requireText(request.getPurchaseToken(), "Purchase token", InputLimits.MAX_TOKEN_LENGTH);
        if (request.getPlatform() == null) {
            throw new InvalidOperationException("Platform is required");
        }
    }

    @Transactional(readOnly = true)
    public List<CreditProduct> getAvailableProducts() {
        return productRepository.findByActiveTrueOrderByCreditsAsc();
    }

    @Transactional(readOnly = true)
    public CreditProduct resolveProduct(String productId) {
        return productRepository.findByProductIdAndActiveTrue(productId)
            .orElseThrow(() -> new InvalidPurchaseException("Product not found: " + productId));
    }

    public void verifyReceipt(PurchaseRequest request) {
        if (!receiptVerifier.verify(request.receiptOrToken(), request.getPlatform())) {
            log.warn("Receipt verification failed for user {} purchase {}",
                request.getUserId(), request.getTransactionId());
            throw new InvalidPurchaseException("Purchase verification failed");
        }
    }

    public long bonusFor(long baseCredits) {
        return baseCredits * bonusPercent / 100;
    }

    /**
     * Build the single ledger entry that records a purchase, base and bonus credits combined.
     */
    public CreditTransaction buildTransaction(PurchaseRequest request, CreditProduct product,
                                              String idempotencyKey, Instant now) {
        long baseCredits = product.getCredits();
        long bonusCredits = bonusFor(baseCredits);

        Map<String, String> metadata = Map.of(
            META_PRODUCT_ID, product.getProductId(),
            META_PLATFORM, request.getPlatform().name(),
            META_PURCHASE_TOKEN, request.getPurchaseToken(),
            META_STORE_TRANSACTION_ID, request.getTransactionId(),
            META_BASE_CREDITS, String.valueOf(baseCredits),
            META_BONUS_CREDITS, String.valueOf(bonusCredits)
        );

        return new CreditTransaction(
            request.getUserId(),
            TransactionType.PURCHASE,
            TransactionType.PURCHASE.signed(baseCredits + bonusCredits),
            "Purchase: " + product.getName(),
            metadata,
            idempotencyKey,
            now
        );
    }

    /**
     * Rebuild the purchase result from its ledger entry.
     */
    public PurchaseResult toResult(CreditTransaction transaction) {
        long baseCredits = Long.parseLong(transaction.metadataValue(META_BASE_CREDITS));
        long bonusCredits = Long.parseLong(transaction.metadataValue(META_BONUS_CREDITS));
        return new PurchaseResult(baseCredits, bonusCredits, TransactionView.from(transaction));
    }
}

package com.creditengine.orchestrator;

import com.creditengine.analytics.AnalyticsQuery;
import com.creditengine.analytics.AnalyticsSnapshot;
import com.creditengine.balance.BalanceView;
import com.creditengine.common.CreditResult;
import com.creditengine.common.ErrorCode;
import com.creditengine.ledger.CreditTransactionRepository;
import com.creditengine.ledger.TransactionFilter;
import com.creditengine.ledger.TransactionType;
import com.creditengine.ledger.TransactionView;
import com.creditengine.purchase.CreditProduct;
import com.creditengine.purchase.Platform;
import com.creditengine.purchase.PurchaseRequest;
import com.creditengine.purchase.PurchaseResult;
import com.creditengine.support.MutableClock;
import com.creditengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the orchestrator's write and read paths.
 *
 * Writes commit through their own transactions, so each test works on fresh user ids.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class CreditOrchestratorTest {

    @Autowired
    private CreditOrchestrator creditOrchestrator;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Autowired
    private MutableClock clock;

    private String userId;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-03-01T10:00:00Z"));
        userId = "user-" + UUID.randomUUID();
    }

    @Test
    void testUnknownUserHasNoBalance() {
        CreditResult<BalanceView> result = creditOrchestrator.getBalance(userId);

        assertTrue(result.failedWith(ErrorCode.BALANCE_NOT_FOUND));
        assertFalse(result.getError().isRetryable());
    }

    @Test
    void testAddAndDeductCredits() {
        BalanceView afterAdd = creditOrchestrator.addCredits(userId, 50, "Welcome credits").getValue();
        assertEquals(50, afterAdd.getTotalCredits());

        BalanceView afterDeduct = creditOrchestrator.deductCredits(userId, 20, "Avatar generation").getValue();
        assertEquals(30, afterDeduct.getTotalCredits());
        assertEquals(50, afterDeduct.getLifetimeEarned());
        assertEquals(20, afterDeduct.getLifetimeSpent());

        assertEquals(30, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
        assertEquals(30, transactionRepository.sumAmountByUserId(userId));
    }

    @Test
    void testDeductNeverOverdraws() {
        creditOrchestrator.addCredits(userId, 10, "Welcome credits");

        CreditResult<BalanceView> result = creditOrchestrator.deductCredits(userId, 11, "Too much");

        assertTrue(result.failedWith(ErrorCode.INSUFFICIENT_CREDITS));
        assertEquals(10, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
        assertEquals(1, transactionRepository.countByUserId(userId));
    }

    @Test
    void testDeductFromUnknownUser() {
        CreditResult<BalanceView> result = creditOrchestrator.deductCredits(userId, 1, "Spend");

        assertTrue(result.failedWith(ErrorCode.BALANCE_NOT_FOUND));
        assertFalse(transactionRepository.existsByUserId(userId));
    }

    @Test
    void testInvalidInputRejectedBeforeWriting() {
        assertTrue(creditOrchestrator.addCredits(userId, 0, "Zero").failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.addCredits(userId, -5, "Negative").failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.addCredits(" ", 5, "Blank user").failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.addCredits(userId, 5, "").failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.deductCredits(userId, 0, "Zero").failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.getBalance(null).failedWith(ErrorCode.INVALID_OPERATION));

        assertFalse(transactionRepository.existsByUserId(userId));
    }

    @Test
    void testOversizedInputRejectedBeforeWriting() {
        String longUserId = "u".repeat(300);
        CreditResult<BalanceView> longUser = creditOrchestrator.addCredits(longUserId, 5, "Welcome credits");
        assertTrue(longUser.failedWith(ErrorCode.INVALID_OPERATION));
        assertFalse(longUser.getError().isRetryable());
        assertFalse(transactionRepository.existsByUserId(longUserId));
        assertTrue(creditOrchestrator.claimDailyBonus(longUserId).failedWith(ErrorCode.INVALID_OPERATION));

        creditOrchestrator.addCredits(userId, 10, "Welcome credits");
        assertTrue(creditOrchestrator.deductCredits(userId, 1, "Spend", Map.of("k".repeat(256), "v"))
            .failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.deductCredits(userId, 1, "Spend", Map.of("feature", "v".repeat(1025)))
            .failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.adminAddCredits(userId, 5, "Goodwill", "a".repeat(300))
            .failedWith(ErrorCode.INVALID_OPERATION));

        assertTrue(creditOrchestrator.processPurchase(purchase("GPA." + UUID.randomUUID(), "p".repeat(300)))
            .failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.processPurchase(purchase("GPA." + "9".repeat(300), "credits_starter"))
            .failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.processPurchase(PurchaseRequest.builder()
                .userId(userId)
                .productId("credits_starter")
                .purchaseToken("t".repeat(1025))
                .platform(Platform.ANDROID)
                .transactionId("GPA." + UUID.randomUUID())
                .build())
            .failedWith(ErrorCode.INVALID_OPERATION));

        assertEquals(1, transactionRepository.countByUserId(userId));
        assertEquals(10, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testMetadataAtColumnLimitsIsStored() {
        creditOrchestrator.addCredits(userId, 10, "Welcome credits");

        CreditResult<BalanceView> result = creditOrchestrator.deductCredits(userId, 1, "Spend",
            Map.of("k".repeat(255), "v".repeat(1024)));

        assertTrue(result.isSuccess());
        assertEquals(9, result.getValue().getTotalCredits());
    }

    @Test
    void testDeductMetadataRecorded() {
        creditOrchestrator.addCredits(userId, 10, "Welcome credits");
        creditOrchestrator.deductCredits(userId, 3, "Avatar generation", Map.of("feature", "avatar"));

        TransactionView spend = creditOrchestrator
            .getUserTransactions(userId, TransactionFilter.builder().type(TransactionType.SPEND).build(), 1, 20)
            .getValue().getTransactions().get(0);

        assertEquals(-3, spend.getAmount());
        assertEquals("avatar", spend.getMetadata().get("feature"));
    }

    @Test
    void testPurchaseGrantsCreditsWithBonus() {
        PurchaseResult result = creditOrchestrator.processPurchase(purchase("GPA." + UUID.randomUUID(), "credits_popular")).getValue();

        assertEquals(35, result.getCreditsGranted());
        assertEquals(3, result.getBonusCredits());
        assertEquals(38, result.getTransaction().getAmount());
        assertEquals(TransactionType.PURCHASE, result.getTransaction().getType());
        assertEquals(38, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testPurchaseRedeliveryIsIdempotent() {
        String storeTransactionId = "GPA." + UUID.randomUUID();

        PurchaseResult first = creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_pro")).getValue();
        clock.advance(Duration.ofMinutes(5));
        PurchaseResult second = creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_pro")).getValue();

        assertEquals(first, second);
        assertEquals(1, transactionRepository.countByUserId(userId));
        assertEquals(82, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testPurchaseKeyCannotBeRedeemedByAnotherUser() {
        String storeTransactionId = "GPA." + UUID.randomUUID();
        creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_starter"));

        String otherUser = "user-" + UUID.randomUUID();
        CreditResult<PurchaseResult> result = creditOrchestrator.processPurchase(PurchaseRequest.builder()
            .userId(otherUser)
            .productId("credits_starter")
            .purchaseToken("token-other")
            .platform(Platform.IOS)
            .transactionId(storeTransactionId)
            .build());

        assertTrue(result.failedWith(ErrorCode.INVALID_PURCHASE));
        assertFalse(transactionRepository.existsByUserId(otherUser));
    }

    @Test
    void testUnknownProductRejectedAndRetryable() {
        String storeTransactionId = "GPA." + UUID.randomUUID();

        CreditResult<PurchaseResult> rejected = creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_missing"));
        assertTrue(rejected.failedWith(ErrorCode.INVALID_PURCHASE));
        assertFalse(transactionRepository.existsByUserId(userId));

        // The failed attempt released its reservation
        CreditResult<PurchaseResult> corrected = creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_starter"));
        assertTrue(corrected.isSuccess());
        assertEquals(13, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testPurchaseRequiresStoreTransactionId() {
        String storeTransactionId = "GPA." + UUID.randomUUID();
        PurchaseRequest tokenOnly = PurchaseRequest.builder()
            .userId(userId)
            .productId("credits_starter")
            .purchaseToken("token-" + storeTransactionId)
            .platform(Platform.ANDROID)
            .build();

        CreditResult<PurchaseResult> rejected = creditOrchestrator.processPurchase(tokenOnly);
        assertTrue(rejected.failedWith(ErrorCode.INVALID_OPERATION));
        assertFalse(rejected.getError().isRetryable());
        assertFalse(transactionRepository.existsByUserId(userId));

        // A token-only redelivery of a redeemed purchase is rejected rather than credited again
        assertTrue(creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_starter")).isSuccess());
        assertTrue(creditOrchestrator.processPurchase(tokenOnly).failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_starter")).isSuccess());

        assertEquals(1, transactionRepository.countByUserId(userId));
        assertEquals(13, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testPurchaseDedupesOnStoreIdRegardlessOfToken() {
        String storeTransactionId = "GPA." + UUID.randomUUID();

        creditOrchestrator.processPurchase(purchase(storeTransactionId, "credits_starter"));
        CreditResult<PurchaseResult> redelivered = creditOrchestrator.processPurchase(PurchaseRequest.builder()
            .userId(userId)
            .productId("credits_starter")
            .purchaseToken("refreshed-token")
            .platform(Platform.ANDROID)
            .transactionId(storeTransactionId)
            .build());

        assertTrue(redelivered.isSuccess());
        assertEquals(1, transactionRepository.countByUserId(userId));
        assertEquals(13, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testRejectedReceipt() {
        CreditResult<PurchaseResult> result = creditOrchestrator.processPurchase(PurchaseRequest.builder()
            .userId(userId)
            .productId("credits_starter")
            .purchaseToken("invalid-token")
            .platform(Platform.ANDROID)
            .transactionId("GPA." + UUID.randomUUID())
            .build());

        assertTrue(result.failedWith(ErrorCode.INVALID_PURCHASE));
        assertFalse(transactionRepository.existsByUserId(userId));
    }

    @Test
    void testAvailableProducts() {
        List<CreditProduct> products = creditOrchestrator.getAvailableProducts().getValue();

        assertEquals(List.of("credits_starter", "credits_popular", "credits_pro", "credits_ultimate"),
            products.stream().map(CreditProduct::getProductId).toList());
    }

    @Test
    void testAdminAdjustments() {
        TransactionView added = creditOrchestrator.adminAddCredits(userId, 100, "Support refund", "admin-7").getValue();
        assertEquals(TransactionType.ADMIN_ADD, added.getType());
        assertEquals("admin-7", added.getMetadata().get("adminId"));
        assertEquals("Support refund", added.getMetadata().get("reason"));

        TransactionView deducted = creditOrchestrator.adminDeductCredits(userId, 40, "Chargeback", "admin-7").getValue();
        assertEquals(-40, deducted.getAmount());

        assertEquals(60, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
        assertTrue(creditOrchestrator.adminDeductCredits(userId, 61, "Too much", "admin-7")
            .failedWith(ErrorCode.INSUFFICIENT_CREDITS));
        assertTrue(creditOrchestrator.adminAddCredits(userId, 5, "Missing admin", " ")
            .failedWith(ErrorCode.INVALID_OPERATION));
    }

    @Test
    void testTransactionHistoryPaging() {
        for (int i = 1; i <= 5; i++) {
            creditOrchestrator.addCredits(userId, i, "Grant " + i);
            clock.advance(Duration.ofHours(12));
        }

        TransactionPage first = creditOrchestrator.getUserTransactions(userId, null, 1, 2).getValue();
        assertEquals(5, first.getTotalCount());
        assertEquals(3, first.getTotalPages());
        assertTrue(first.isHasMore());
        assertEquals(List.of(5L, 4L), first.getTransactions().stream().map(TransactionView::getAmount).toList());

        TransactionPage last = creditOrchestrator.getUserTransactions(userId, null, 3, 2).getValue();
        assertFalse(last.isHasMore());
        assertEquals(1, last.getTransactions().size());
        assertEquals(1, last.getTransactions().get(0).getAmount());

        TransactionPage all = creditOrchestrator.getUserTransactions(userId, null, 1, 20).getValue();
        assertEquals(List.of("2026-03-03", "2026-03-02", "2026-03-01"),
            List.copyOf(all.getTransactionsByDate().keySet()));
        assertEquals(2, all.getTransactionsByDate().get("2026-03-01").size());
    }

    @Test
    void testTransactionHistoryFiltersAndLimits() {
        creditOrchestrator.addCredits(userId, 50, "Welcome credits");
        creditOrchestrator.deductCredits(userId, 5, "Spend");

        TransactionFilter spendOnly = TransactionFilter.builder().type(TransactionType.SPEND).build();
        assertEquals(1, creditOrchestrator.getUserTransactions(userId, spendOnly, 1, 20).getValue().getTotalCount());

        assertTrue(creditOrchestrator.getUserTransactions(userId, null, 0, 20).failedWith(ErrorCode.INVALID_OPERATION));
        assertTrue(creditOrchestrator.getUserTransactions(userId, null, 1, 0).failedWith(ErrorCode.INVALID_OPERATION));
        assertEquals(2, creditOrchestrator.getUserTransactions(userId, null, 1, 1000).getValue().getTransactions().size());
    }

    @Test
    void testAnalyticsReflectsLedger() {
        creditOrchestrator.addCredits(userId, 50, "Welcome credits");
        creditOrchestrator.processPurchase(purchase("GPA." + UUID.randomUUID(), "credits_starter"));
        creditOrchestrator.deductCredits(userId, 20, "Spend");
        creditOrchestrator.adminAddCredits(userId, 7, "Goodwill", "admin-1");

        AnalyticsSnapshot all = creditOrchestrator.getCreditAnalytics(AnalyticsQuery.forUser(userId)).getValue();
        assertEquals(50, all.getCurrentBalance());
        assertEquals(70, all.getTotalEarned());
        assertEquals(20, all.getTotalSpent());
        assertEquals(1, all.getTotalPurchases());
        assertEquals(4, all.getTransactionCount());

        AnalyticsSnapshot withoutAdmin = creditOrchestrator.getCreditAnalytics(AnalyticsQuery.builder()
            .userId(userId)
            .includeAdmin(false)
            .build()).getValue();
        assertEquals(63, withoutAdmin.getTotalEarned());
        assertEquals(3, withoutAdmin.getTransactionCount());
    }

    @Test
    void testPlatformAnalyticsCountsUsers() {
        long usersBefore = creditOrchestrator.getPlatformAnalytics().getValue().getTotalUsers();

        creditOrchestrator.addCredits(userId, 5, "Welcome credits");

        assertEquals(usersBefore + 1, creditOrchestrator.getPlatformAnalytics().getValue().getTotalUsers());
    }

    private PurchaseRequest purchase(String storeTransactionId, String productId) {
        return PurchaseRequest.builder()
            .userId(userId)
            .productId(productId)
            .purchaseToken("token-" + storeTransactionId)
            .platform(Platform.ANDROID)
            .transactionId(storeTransactionId)
            .build();
    }
}

package com.creditengine.orchestrator;

import com.creditengine.analytics.AnalyticsQuery;
import com.creditengine.analytics.AnalyticsSnapshot;
import com.creditengine.analytics.PlatformAnalytics;
import com.creditengine.balance.BalanceView;
import com.creditengine.balance.ReconciliationResult;
import com.creditengine.balance.ReconciliationSummary;
import com.creditengine.bonus.DailyBonusStatus;
import com.creditengine.common.CreditResult;
import com.creditengine.ledger.TransactionFilter;
import com.creditengine.ledger.TransactionView;
import com.creditengine.purchase.CreditProduct;
import com.creditengine.purchase.PurchaseRequest;
import com.creditengine.purchase.PurchaseResult;
import com.creditengine.referral.ReferralReconciliationReport;
import com.creditengine.referral.ReferralRequest;
import com.creditengine.referral.ReferralResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every credit operation.
 *
 * Methods never throw for domain or storage failures. They return a
 * {@link CreditResult} carrying either the payload or a typed error, and only
 * errors flagged retryable may be retried automatically.
 */
public interface CreditOrchestrator {

    /**
     * Current cached balance. Fails with BALANCE_NOT_FOUND for a user with no history.
     */
    CreditResult<BalanceView> getBalance(String userId);

    CreditResult<BalanceView> addCredits(String userId, long amount, String description);

    /**
     * Spend credits. Never takes a balance below zero.
     */
    CreditResult<BalanceView> deductCredits(String userId, long amount, String description);

    CreditResult<BalanceView> deductCredits(String userId, long amount, String description,
                                            Map<String, String> metadata);

    /**
     * Redeem a store purchase. Redelivery of the same purchase returns an equal
     * result without writing again.
     */
    CreditResult<PurchaseResult> processPurchase(PurchaseRequest request);

    CreditResult<DailyBonusStatus> getDailyBonusStatus(String userId);

    /**
     * Claim today's bonus. A second claim on the same day fails with
     * DAILY_BONUS_ALREADY_CLAIMED.
     */
    CreditResult<DailyBonusClaimResult> claimDailyBonus(String userId);

    /**
     * Pay both sides of a referral. Each side is credited by its own idempotent
     * write; retrying a referral that stopped halfway writes only the missing side.
     */
    CreditResult<ReferralResult> processReferral(ReferralRequest request);

    /**
     * @param page 1-based page number
     * @param limit page size, capped at the configured maximum
     */
    CreditResult<TransactionPage> getUserTransactions(String userId, TransactionFilter filter, int page, int limit);

    CreditResult<AnalyticsSnapshot> getCreditAnalytics(AnalyticsQuery query);

    CreditResult<TransactionView> adminAddCredits(String userId, long amount, String reason, String adminId);

    CreditResult<TransactionView> adminDeductCredits(String userId, long amount, String reason, String adminId);

    CreditResult<List<CreditProduct>> getAvailableProducts();

    CreditResult<PlatformAnalytics> getPlatformAnalytics();

    CreditResult<ReconciliationResult> reconcileBalance(String userId, boolean repair);

    CreditResult<ReconciliationSummary> reconcileAllBalances(boolean repair);

    CreditResult<ReferralReconciliationReport> resumePendingReferrals(Duration olderThan);
}

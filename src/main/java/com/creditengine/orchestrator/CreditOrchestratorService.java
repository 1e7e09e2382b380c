package com.creditengine.orchestrator;

import com.creditengine.analytics.AnalyticsAggregator;
import com.creditengine.analytics.AnalyticsQuery;
import com.creditengine.analytics.AnalyticsSnapshot;
import com.creditengine.analytics.PlatformAnalytics;
import com.creditengine.balance.BalanceProjector;
import com.creditengine.balance.BalanceView;
import com.creditengine.balance.ReconciliationResult;
import com.creditengine.balance.ReconciliationSummary;
import com.creditengine.bonus.DailyBonusStatus;
import com.creditengine.bonus.StreakAdvance;
import com.creditengine.bonus.StreakTracker;
import com.creditengine.common.CreditError;
import com.creditengine.common.CreditResult;
import com.creditengine.common.ErrorCode;
import com.creditengine.common.IdempotencyKey;
import com.creditengine.common.InputLimits;
import com.creditengine.common.exception.CreditEngineException;
import com.creditengine.common.exception.DailyBonusAlreadyClaimedException;
import com.creditengine.common.exception.InvalidOperationException;
import com.creditengine.common.exception.InvalidPurchaseException;
import com.creditengine.idempotency.IdempotentOperation;
import com.creditengine.ledger.CreditTransaction;
import com.creditengine.ledger.LedgerService;
import com.creditengine.ledger.TransactionFilter;
import com.creditengine.ledger.TransactionType;
import com.creditengine.ledger.TransactionView;
import com.creditengine.purchase.CreditProduct;
import com.creditengine.purchase.PurchaseRequest;
import com.creditengine.purchase.PurchaseResult;
import com.creditengine.purchase.PurchaseService;
import com.creditengine.referral.ReferralProcessor;
import com.creditengine.referral.ReferralReconciler;
import com.creditengine.referral.ReferralReconciliationReport;
import com.creditengine.referral.ReferralRequest;
import com.creditengine.referral.ReferralResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Default {@link CreditOrchestrator}.
 *
 * Write flow: validate input, then hand the entry to {@link CreditWriter},
 * which locks the user, resolves idempotency and commits the ledger entry
 * together with the balance and any derived state. Reads go straight to the
 * balance cache, the ledger or the analytics aggregator.
 */
@Service
@Slf4j
public class CreditOrchestratorService implements CreditOrchestrator {

    private static final int MAX_DESCRIPTION_LENGTH = 255;

    private final CreditWriter creditWriter;
    private final LedgerService ledgerService;
    private final BalanceProjector balanceProjector;
    private final StreakTracker streakTracker;
    private final PurchaseService purchaseService;
    private final ReferralProcessor referralProcessor;
    private final ReferralReconciler referralReconciler;
    private final AnalyticsAggregator analyticsAggregator;
    private final Clock clock;
    private final int maxHistoryLimit;

    public CreditOrchestratorService(CreditWriter creditWriter,
                                     LedgerService ledgerService,
                                     BalanceProjector balanceProjector,
                                     StreakTracker streakTracker,
                                     PurchaseService purchaseService,
                                     ReferralProcessor referralProcessor,
                                     ReferralReconciler referralReconciler,
                                     AnalyticsAggregator analyticsAggregator,
                                     Clock clock,
                                     @Value("${credit-engine.history.max-limit:100}") int maxHistoryLimit) {
        this.creditWriter = creditWriter;
        this.ledgerService = ledgerService;
        this.balanceProjector = balanceProjector;
        this.streakTracker = streakTracker;
        this.purchaseService = purchaseService;
        this.referralProcessor = referralProcessor;
        this.referralReconciler = referralReconciler;
        this.analyticsAggregator = analyticsAggregator;
        this.clock = clock;
        this.maxHistoryLimit = maxHistoryLimit;
    }

    @Override
    public CreditResult<BalanceView> getBalance(String userId) {
        return execute("getBalance", () -> {
            requireUserId(userId);
            return balanceProjector.getBalance(userId);
        });
    }

    @Override
    public CreditResult<BalanceView> addCredits(String userId, long amount, String description) {
        return execute("addCredits", () -> {
            requireUserId(userId);
            requirePositive(amount);
            requireDescription(description);

            Posting posting = creditWriter.post(userId, () -> new CreditTransaction(
                userId, TransactionType.GRANT, TransactionType.GRANT.signed(amount),
                description, Map.of(), null, clock.instant()));
            return posting.getBalance();
        });
    }

    @Override
    public CreditResult<BalanceView> deductCredits(String userId, long amount, String description) {
        return deductCredits(userId, amount, description, Map.of());
    }

    @Override
    public CreditResult<BalanceView> deductCredits(String userId, long amount, String description,
                                                   Map<String, String> metadata) {
        return execute("deductCredits", () -> {
            requireUserId(userId);
            requirePositive(amount);
            requireDescription(description);
            InputLimits.requireMetadata(metadata);

            Posting posting = creditWriter.post(userId, () -> new CreditTransaction(
                userId, TransactionType.SPEND, TransactionType.SPEND.signed(amount),
                description, metadata, null, clock.instant()));
            return posting.getBalance();
        });
    }

    @Override
    public CreditResult<PurchaseResult> processPurchase(PurchaseRequest request) {
        return execute("processPurchase", () -> {
            purchaseService.validate(request);
            String userId = request.getUserId();
            String key = IdempotencyKey.forPurchase(request.getTransactionId());

            Posting posting = creditWriter.postOnce(userId, key, IdempotentOperation.PURCHASE,
                () -> new InvalidPurchaseException("Purchase " + request.getTransactionId()
                    + " was already redeemed by another user"),
                () -> {
                    CreditProduct product = purchaseService.resolveProduct(request.getProductId());
                    purchaseService.verifyReceipt(request);
                    return purchaseService.buildTransaction(request, product, key, clock.instant());
                });

            return purchaseService.toResult(posting.getTransaction());
        });
    }

    @Override
    public CreditResult<DailyBonusStatus> getDailyBonusStatus(String userId) {
        return execute("getDailyBonusStatus", () -> {
            requireUserId(userId);
            return streakTracker.getStatus(userId);
        });
    }

    @Override
    public CreditResult<DailyBonusClaimResult> claimDailyBonus(String userId) {
        return execute("claimDailyBonus", () -> {
            requireUserId(userId);
            LocalDate today = streakTracker.today();
            String key = IdempotencyKey.forDailyBonus(userId, today);
            AtomicReference<StreakAdvance> advance = new AtomicReference<>();

            Posting posting = creditWriter.postOnce(userId, key, IdempotentOperation.DAILY_BONUS,
                () -> new InvalidOperationException("Daily bonus key " + key + " belongs to another user"),
                () -> {
                    StreakAdvance claimed = streakTracker.claim(userId, today);
                    advance.set(claimed);
                    return new CreditTransaction(
                        userId,
                        TransactionType.DAILY_BONUS,
                        TransactionType.DAILY_BONUS.signed(claimed.getBonusAmount()),
                        "Daily bonus - day " + claimed.getNewStreak(),
                        Map.of(
                            "claimDate", today.toString(),
                            "streak", String.valueOf(claimed.getNewStreak()),
                            "previousStreak", String.valueOf(claimed.getPreviousStreak())
                        ),
                        key,
                        clock.instant()
                    );
                });

            if (posting.isReplayed()) {
                throw new DailyBonusAlreadyClaimedException(userId, today);
            }

            StreakAdvance claimed = advance.get();
            return DailyBonusClaimResult.builder()
                .userId(userId)
                .claimDate(today)
                .bonusAmount(claimed.getBonusAmount())
                .streak(claimed.getNewStreak())
                .newBalance(posting.getBalance().getTotalCredits())
                .transaction(TransactionView.from(posting.getTransaction()))
                .build();
        });
    }

    @Override
    public CreditResult<ReferralResult> processReferral(ReferralRequest request) {
        return execute("processReferral", () -> referralProcessor.process(request));
    }

    @Override
    public CreditResult<TransactionPage> getUserTransactions(String userId, TransactionFilter filter,
                                                             int page, int limit) {
        return execute("getUserTransactions", () -> {
            requireUserId(userId);
            if (page < 1) {
                throw new InvalidOperationException("Page must be 1 or greater");
            }
            if (limit < 1) {
                throw new InvalidOperationException("Limit must be 1 or greater");
            }
            int pageSize = Math.min(limit, maxHistoryLimit);
            TransactionFilter effective = filter != null ? filter : TransactionFilter.none();

            Page<CreditTransaction> result = ledgerService.listForUser(userId, effective, page - 1, pageSize);

            List<TransactionView> views = result.getContent().stream()
                .map(TransactionView::from)
                .toList();

            Map<String, List<TransactionView>> byDate = new LinkedHashMap<>();
            for (TransactionView view : views) {
                String date = LocalDate.ofInstant(view.getCreatedAt(), ZoneOffset.UTC).toString();
                byDate.computeIfAbsent(date, d -> new ArrayList<>()).add(view);
            }

            return TransactionPage.builder()
                .transactions(views)
                .transactionsByDate(byDate)
                .totalCount(result.getTotalElements())
                .currentPage(page)
                .totalPages(result.getTotalPages())
                .hasMore(result.hasNext())
                .build();
        });
    }

    @Override
    public CreditResult<AnalyticsSnapshot> getCreditAnalytics(AnalyticsQuery query) {
        return execute("getCreditAnalytics", () -> analyticsAggregator.summarize(query));
    }

    @Override
    public CreditResult<TransactionView> adminAddCredits(String userId, long amount, String reason, String adminId) {
        return execute("adminAddCredits", () -> adminAdjust(TransactionType.ADMIN_ADD, userId, amount, reason, adminId));
    }

    @Override
    public CreditResult<TransactionView> adminDeductCredits(String userId, long amount, String reason, String adminId) {
        return execute("adminDeductCredits", () -> adminAdjust(TransactionType.ADMIN_DEDUCT, userId, amount, reason, adminId));
    }

    @Override
    public CreditResult<List<CreditProduct>> getAvailableProducts() {
        return execute("getAvailableProducts", purchaseService::getAvailableProducts);
    }

    @Override
    public CreditResult<PlatformAnalytics> getPlatformAnalytics() {
        return execute("getPlatformAnalytics", analyticsAggregator::platformTotals);
    }

    @Override
    public CreditResult<ReconciliationResult> reconcileBalance(String userId, boolean repair) {
        return execute("reconcileBalance", () -> {
            requireUserId(userId);
            return balanceProjector.reconcile(userId, repair);
        });
    }

    @Override
    public CreditResult<ReconciliationSummary> reconcileAllBalances(boolean repair) {
        return execute("reconcileAllBalances", () -> balanceProjector.reconcileAll(repair));
    }

    @Override
    public CreditResult<ReferralReconciliationReport> resumePendingReferrals(Duration olderThan) {
        return execute("resumePendingReferrals", () -> {
            if (olderThan == null || olderThan.isNegative()) {
                throw new InvalidOperationException("Age threshold must be zero or positive");
            }
            return referralReconciler.resumeStale(olderThan);
        });
    }

    private TransactionView adminAdjust(TransactionType type, String userId, long amount,
                                        String reason, String adminId) {
        requireUserId(userId);
        requirePositive(amount);
        if (reason == null || reason.isBlank()) {
            throw new InvalidOperationException("Reason is required for admin adjustments");
        }
        InputLimits.requireId(adminId, "Admin ID");

        Map<String, String> metadata = new HashMap<>();
        metadata.put("adminId", adminId);
        metadata.put("reason", reason);

        String description = "Admin adjustment: " + reason;
        requireDescription(description);

        Posting posting = creditWriter.post(userId, () -> new CreditTransaction(
            userId, type, type.signed(amount), description, metadata, null, clock.instant()));

        log.info("Admin {} applied {} of {} credits to user {}", adminId, type, amount, userId);
        return TransactionView.from(posting.getTransaction());
    }

    private <T> CreditResult<T> execute(String operation, Supplier<T> action) {
        try {
            return CreditResult.success(action.get());
        } catch (CreditEngineException e) {
            if (e.isRetryable()) {
                log.warn("{} failed with retryable {}: {}", operation, e.getErrorCode(), e.getMessage());
            } else {
                log.info("{} rejected with {}: {}", operation, e.getErrorCode(), e.getMessage());
            }
            return CreditResult.failure(CreditError.from(e));
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed in storage", operation, e);
            return CreditResult.failure(ErrorCode.TRANSACTION_FAILED, "Storage failure during " + operation);
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            return CreditResult.failure(ErrorCode.INTERNAL_ERROR, "Unexpected error during " + operation);
        }
    }

    private static void requireUserId(String userId) {
        InputLimits.requireId(userId, "User ID");
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidOperationException("Amount must be positive: " + amount);
        }
    }

    private static void requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new InvalidOperationException("Description is required");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidOperationException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}

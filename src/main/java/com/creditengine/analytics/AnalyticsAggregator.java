package com.creditengine.analytics;

import com.creditengine.balance.BalanceProjector;
import com.creditengine.balance.BalanceView;
import com.creditengine.common.exception.InvalidOperationException;
import com.creditengine.ledger.CreditTransaction;
import com.creditengine.ledger.CreditTransactionRepository;
import com.creditengine.ledger.LedgerService;
import com.creditengine.ledger.TransactionFilter;
import com.creditengine.ledger.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only statistics over the ledger.
 *
 * A user's history is read oldest first in pages and the scan stops at a
 * configured maximum, so one request never loads an unbounded history.
 */
@Service
@Slf4j
public class AnalyticsAggregator {

    private static final DateTimeFormatter MONTH_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final LedgerService ledgerService;
    private final BalanceProjector balanceProjector;
    private final CreditTransactionRepository transactionRepository;
    private final int pageSize;
    private final int maxTransactions;

    public AnalyticsAggregator(LedgerService ledgerService,
                               BalanceProjector balanceProjector,
                               CreditTransactionRepository transactionRepository,
                               @Value("${credit-engine.analytics.page-size:200}") int pageSize,
                               @Value("${credit-engine.analytics.max-transactions:5000}") int maxTransactions) {
        if (pageSize <= 0 || maxTransactions <= 0) {
            throw new IllegalArgumentException("Analytics page size and scan limit must be positive");
        }
        this.ledgerService = ledgerService;
        this.balanceProjector = balanceProjector;
        this.transactionRepository = transactionRepository;
        this.pageSize = pageSize;
        this.maxTransactions = maxTransactions;
    }

    @Transactional(readOnly = true)
    public AnalyticsSnapshot summarize(AnalyticsQuery query) {
        if (query == null || query.getUserId() == null || query.getUserId().isBlank()) {
            throw new InvalidOperationException("User ID is required");
        }
        if (query.getFrom() != null && query.getTo() != null && query.getFrom().isAfter(query.getTo())) {
            throw new InvalidOperationException("Analytics range start must not be after its end");
        }

        String userId = query.getUserId();
        TransactionFilter filter = TransactionFilter.builder()
            .from(query.getFrom())
            .to(query.getTo())
            .direction(Sort.Direction.ASC)
            .build();

        Accumulator totals = new Accumulator();
        boolean truncated = false;
        int pageIndex = 0;

        while (true) {
            Page<CreditTransaction> page = ledgerService.listForUser(userId, filter, pageIndex, pageSize);
            for (CreditTransaction transaction : page.getContent()) {
                if (totals.scanned == maxTransactions) {
                    truncated = true;
                    break;
                }
                totals.scanned++;
                if (query.isIncludeAdmin() || !transaction.getType().isAdmin()) {
                    totals.add(transaction);
                }
            }
            if (truncated || !page.hasNext()) {
                break;
            }
            pageIndex++;
        }

        if (truncated) {
            log.warn("Analytics for user {} truncated after {} transactions", userId, maxTransactions);
        }

        long currentBalance = balanceProjector.findBalance(userId)
            .map(BalanceView::getTotalCredits)
            .orElse(0L);

        return AnalyticsSnapshot.builder()
            .userId(userId)
            .currentBalance(currentBalance)
            .totalEarned(totals.earned)
            .totalSpent(totals.spent)
            .totalPurchases(totals.countOf(TransactionType.PURCHASE))
            .dailyBonusesClaimed(totals.countOf(TransactionType.DAILY_BONUS))
            .referralCredits(totals.creditsByType.getOrDefault(TransactionType.REFERRAL, 0L))
            .transactionsByType(Map.copyOf(totals.countByType))
            .creditsByType(Map.copyOf(totals.creditsByType))
            .creditsByMonth(totals.monthly())
            .transactionCount(totals.counted)
            .truncated(truncated)
            .build();
    }

    @Transactional(readOnly = true)
    public PlatformAnalytics platformTotals() {
        return PlatformAnalytics.builder()
            .totalUsers(transactionRepository.countDistinctUsers())
            .totalCreditsIssued(transactionRepository.sumCreditsIssued())
            .totalCreditsSpent(transactionRepository.sumCreditsSpent())
            .totalPurchases(transactionRepository.countByType(TransactionType.PURCHASE))
            .dailyBonusesClaimed(transactionRepository.countByType(TransactionType.DAILY_BONUS))
            .referralPayouts(transactionRepository.countByType(TransactionType.REFERRAL))
            .build();
    }

    private static final class Accumulator {
        private final Map<TransactionType, Long> countByType = new EnumMap<>(TransactionType.class);
        private final Map<TransactionType, Long> creditsByType = new EnumMap<>(TransactionType.class);
        private final Map<String, long[]> byMonth = new TreeMap<>();
        private long earned;
        private long spent;
        private long scanned;
        private long counted;

        void add(CreditTransaction transaction) {
            long amount = transaction.getAmount();
            countByType.merge(transaction.getType(), 1L, Long::sum);
            creditsByType.merge(transaction.getType(), amount, Long::sum);

            // [earned, spent]
            long[] month = byMonth.computeIfAbsent(MONTH_FORMAT.format(transaction.getCreatedAt()), m -> new long[2]);
            if (amount >= 0) {
                earned += amount;
                month[0] += amount;
            } else {
                spent -= amount;
                month[1] -= amount;
            }
            counted++;
        }

        long countOf(TransactionType type) {
            return countByType.getOrDefault(type, 0L);
        }

        List<MonthlyCredits> monthly() {
            List<MonthlyCredits> result = new ArrayList<>(byMonth.size());
            byMonth.forEach((month, totals) -> result.add(new MonthlyCredits(month, totals[0], totals[1])));
            return List.copyOf(result);
        }
    }
}

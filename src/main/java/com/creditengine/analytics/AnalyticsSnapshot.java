package com.creditengine.analytics;

import com.creditengine.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-user credit statistics computed from the ledger.
 */
@Value
@Builder
public class AnalyticsSnapshot {
    String userId;
    long currentBalance;
    long totalEarned;
    long totalSpent;
    long totalPurchases;
    long dailyBonusesClaimed;
    long referralCredits;
    Map<TransactionType, Long> transactionsByType;
    Map<TransactionType, Long> creditsByType;
    List<MonthlyCredits> creditsByMonth;
    long transactionCount;

    /**
     * True when the history exceeded the scan limit and only the oldest
     * entries in range were counted.
     */
    boolean truncated;
}

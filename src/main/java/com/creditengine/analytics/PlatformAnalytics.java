package com.creditengine.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Engine-wide credit totals for administrators.
 */
@Value
@Builder
public class PlatformAnalytics {
    long totalUsers;
    long totalCreditsIssued;
    long totalCreditsSpent;
    long totalPurchases;
    long dailyBonusesClaimed;
    long referralPayouts;
}

package com.creditengine.referral;

import java.util.List;

/**
 * Result of re-driving stale PENDING referrals.
 */
public record ReferralReconciliationReport(
    int examined,
    int completed,
    List<String> failedReferralIds
) {
    public boolean isClean() {
        return failedReferralIds.isEmpty();
    }
}

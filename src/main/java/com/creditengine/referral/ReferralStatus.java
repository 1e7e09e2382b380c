package com.creditengine.referral;

public enum ReferralStatus {
    /**
     * Recorded; one or both payout legs may still be missing.
     */
    PENDING,

    /**
     * Both legs are in the ledger.
     */
    COMPLETED
}

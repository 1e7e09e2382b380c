package com.creditengine.referral;

/**
 * What triggered a referral payout, and how much each side receives.
 */
public enum ReferralType {
    SIGNUP(50, 25),
    PURCHASE(20, 30),
    ACHIEVEMENT(15, 15);

    private final long refereeCredits;
    private final long referrerCredits;

    ReferralType(long refereeCredits, long referrerCredits) {
        this.refereeCredits = refereeCredits;
        this.referrerCredits = referrerCredits;
    }

    public long getRefereeCredits() {
        return refereeCredits;
    }

    public long getReferrerCredits() {
        return referrerCredits;
    }
}

package com.creditengine.referral;

import lombok.Builder;
import lombok.Value;

/**
 * Credits paid to both sides of a completed referral.
 */
@Value
@Builder
public class ReferralResult {
    String referralId;
    String referrerUserId;
    String refereeUserId;
    long referrerCredits;
    long refereeCredits;
    String referrerTransactionId;
    String refereeTransactionId;
}

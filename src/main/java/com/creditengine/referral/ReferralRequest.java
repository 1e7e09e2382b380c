package com.creditengine.referral;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReferralRequest {
    String referrerUserId;
    String refereeUserId;
    String referralCode;
    ReferralType type;
}

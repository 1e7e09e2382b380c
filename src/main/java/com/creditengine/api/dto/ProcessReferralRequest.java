package com.creditengine.api.dto;

import com.creditengine.referral.ReferralRequest;
import com.creditengine.referral.ReferralType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for paying out a referral.
 */
@Data
public class ProcessReferralRequest {

    @NotBlank(message = "Referrer user ID is required")
    @Size(max = 128, message = "Referrer user ID must be at most 128 characters")
    private String referrerUserId;

    @NotBlank(message = "Referee user ID is required")
    @Size(max = 128, message = "Referee user ID must be at most 128 characters")
    private String refereeUserId;

    @NotBlank(message = "Referral code is required")
    @Size(max = 128, message = "Referral code must be at most 128 characters")
    private String referralCode;

    @NotNull(message = "Referral type is required")
    private ReferralType type;

    public ReferralRequest toReferralRequest() {
        return ReferralRequest.builder()
            .referrerUserId(referrerUserId)
            .refereeUserId(refereeUserId)
            .referralCode(referralCode)
            .type(type)
            .build();
    }
}

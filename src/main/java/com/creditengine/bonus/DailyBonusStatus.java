package com.creditengine.bonus;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Whether a user can claim today, and what the claim would grant.
 */
@Value
@Builder
public class DailyBonusStatus {
    String userId;
    boolean canClaim;

    /**
     * Streak that still counts today. Zero once a day has been skipped.
     */
    int currentStreak;

    /**
     * Amount the next claim grants.
     */
    int nextBonusAmount;

    LocalDate lastClaimDate;
    LocalDate nextEligibleDate;
}

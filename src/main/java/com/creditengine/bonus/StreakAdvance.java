package com.creditengine.bonus;

import lombok.Value;

import java.time.LocalDate;

/**
 * Streak transition produced by a successful claim.
 */
@Value
public class StreakAdvance {
    String userId;
    LocalDate claimDate;
    int previousStreak;
    int newStreak;
    int bonusAmount;
}

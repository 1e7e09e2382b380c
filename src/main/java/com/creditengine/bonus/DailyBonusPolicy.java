package com.creditengine.bonus;

/**
 * Bonus amounts for daily claims.
 *
 * The amount grows by two credits per day of streak and stops growing at
 * a streak of seven: 10, 12, 14, ... 24.
 */
public final class DailyBonusPolicy {

    public static final int BASE_AMOUNT = 10;
    public static final int PER_DAY_INCREMENT = 2;
    public static final int MAX_STREAK_BONUS = 14;

    private DailyBonusPolicy() {
    }

    /**
     * @param streak consecutive-day streak before the claim
     */
    public static int bonusFor(int streak) {
        if (streak < 0) {
            throw new IllegalArgumentException("Streak cannot be negative: " + streak);
        }
        long streakBonus = Math.min((long) streak * PER_DAY_INCREMENT, MAX_STREAK_BONUS);
        return BASE_AMOUNT + (int) streakBonus;
    }
}

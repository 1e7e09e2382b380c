package com.creditengine.common;

import com.creditengine.common.exception.InvalidOperationException;

import java.time.LocalDate;

/**
 * Utility class for building and validating idempotency keys.
 *
 * Keys are scoped by operation so a purchase token can never collide with a
 * daily-bonus claim or a referral leg.
 */
public final class IdempotencyKey {

    public static final int MAX_LENGTH = 255;

    private IdempotencyKey() {
    }

    public static boolean isValid(String key) {
        return key != null && !key.trim().isEmpty() && key.length() <= MAX_LENGTH;
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new InvalidOperationException("Invalid idempotency key: " + key);
        }
    }

    public static String forPurchase(String externalTransactionId) {
        return scoped("purchase", externalTransactionId);
    }

    public static String forDailyBonus(String userId, LocalDate claimDate) {
        return scoped("daily-bonus", userId + ":" + claimDate);
    }

    public static String forReferralLeg(String referralId, String leg) {
        return scoped("referral", referralId + ":" + leg);
    }

    private static String scoped(String scope, String value) {
        String key = scope + ":" + value;
        validate(key);
        return key;
    }
}

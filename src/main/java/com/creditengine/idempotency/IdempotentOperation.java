package com.creditengine.idempotency;

/**
 * Externally triggerable operations guarded by an idempotency key.
 */
public enum IdempotentOperation {
    PURCHASE,
    DAILY_BONUS,
    REFERRAL
}

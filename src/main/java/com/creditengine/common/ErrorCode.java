package com.creditengine.common;

/**
 * Stable error codes surfaced by the credit engine.
 *
 * Only retryable codes may be retried automatically by a caller. Domain rule
 * violations must be surfaced for correction, never silently retried.
 */
public enum ErrorCode {

    /**
     * Bad input: missing user id, non-positive amount, unknown operation.
     */
    INVALID_OPERATION(false),

    /**
     * The user has no ledger history yet. Distinct from a zero balance.
     */
    BALANCE_NOT_FOUND(false),

    /**
     * The operation would take the balance below zero.
     */
    INSUFFICIENT_CREDITS(false),

    /**
     * The daily bonus was already claimed for the current calendar date.
     */
    DAILY_BONUS_ALREADY_CLAIMED(false),

    /**
     * Unknown product, failed receipt verification or a token owned by another user.
     */
    INVALID_PURCHASE(false),

    /**
     * Self-referral, reused referral or malformed referral request.
     */
    REFERRAL_NOT_VALID(false),

    /**
     * Storage-layer failure or timeout.
     */
    TRANSACTION_FAILED(true),

    /**
     * Another request holds a live reservation for the same idempotency key.
     */
    OPERATION_IN_PROGRESS(true),

    /**
     * Logic error inside the engine (e.g. duplicate transaction id).
     */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

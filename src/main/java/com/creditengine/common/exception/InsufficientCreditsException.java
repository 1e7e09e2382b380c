package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a debit would take a balance below zero.
 */
public class InsufficientCreditsException extends CreditEngineException {

    private final long required;
    private final long available;

    public InsufficientCreditsException(String userId, long required, long available) {
        super(ErrorCode.INSUFFICIENT_CREDITS,
            String.format("Insufficient credits for user %s. Required: %d, Available: %d",
                userId, required, available));
        this.required = required;
        this.available = available;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}

package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a live reservation already exists for an idempotency key.
 */
public class OperationInProgressException extends CreditEngineException {

    private final String idempotencyKey;

    public OperationInProgressException(String idempotencyKey) {
        super(ErrorCode.OPERATION_IN_PROGRESS, "Operation already in progress for key: " + idempotencyKey);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}

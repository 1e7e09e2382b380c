package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when the storage layer fails or times out. Safe to retry.
 */
public class TransactionFailedException extends CreditEngineException {

    public TransactionFailedException(String message) {
        super(ErrorCode.TRANSACTION_FAILED, message);
    }

    public TransactionFailedException(String message, Throwable cause) {
        super(ErrorCode.TRANSACTION_FAILED, message, cause);
    }
}

package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a transaction id is appended twice. Indicates a bug, not a user error.
 */
public class DuplicateTransactionException extends CreditEngineException {

    public DuplicateTransactionException(String transactionId) {
        super(ErrorCode.INTERNAL_ERROR, "Duplicate ledger transaction id: " + transactionId);
    }
}

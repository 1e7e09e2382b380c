package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a user has no ledger history yet.
 */
public class BalanceNotFoundException extends CreditEngineException {

    public BalanceNotFoundException(String userId) {
        super(ErrorCode.BALANCE_NOT_FOUND, "No credit balance for user: " + userId);
    }
}

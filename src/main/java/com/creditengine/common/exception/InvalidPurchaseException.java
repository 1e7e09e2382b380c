package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a purchase cannot be redeemed.
 */
public class InvalidPurchaseException extends CreditEngineException {

    public InvalidPurchaseException(String message) {
        super(ErrorCode.INVALID_PURCHASE, message);
    }
}

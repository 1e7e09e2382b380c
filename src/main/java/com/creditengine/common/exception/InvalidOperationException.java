package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a request fails input validation. Nothing has been written.
 */
public class InvalidOperationException extends CreditEngineException {

    public InvalidOperationException(String message) {
        super(ErrorCode.INVALID_OPERATION, message);
    }
}

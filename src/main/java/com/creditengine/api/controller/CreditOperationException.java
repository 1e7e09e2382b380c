package com.creditengine.api.controller;

import com.creditengine.common.CreditError;
import com.creditengine.common.CreditResult;

/**
 * Carries a failed {@link CreditResult} out of a controller to the exception handler.
 */
public class CreditOperationException extends RuntimeException {

    private final CreditError error;

    public CreditOperationException(CreditError error) {
        super(error.getMessage());
        this.error = error;
    }

    public CreditError getError() {
        return error;
    }

    static <T> T unwrap(CreditResult<T> result) {
        if (result.isFailure()) {
            throw new CreditOperationException(result.getError());
        }
        return result.getValue();
    }
}

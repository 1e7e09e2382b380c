package com.creditengine.common;

import com.creditengine.common.exception.CreditEngineException;
import lombok.Value;

/**
 * Typed error value returned across the orchestrator boundary.
 */
@Value
public class CreditError {
    ErrorCode code;
    String message;

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static CreditError of(ErrorCode code, String message) {
        return new CreditError(code, message);
    }

    public static CreditError from(CreditEngineException e) {
        return new CreditError(e.getErrorCode(), e.getMessage());
    }
}

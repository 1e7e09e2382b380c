package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Base exception for all credit engine exceptions.
 *
 * Carries a stable {@link ErrorCode}. These exceptions are internal to the
 * engine: the orchestrator converts them into typed failures.
 */
public class CreditEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    public CreditEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CreditEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}

package com.creditengine.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.NoSuchElementException;

/**
 * Outcome of an orchestrator operation: either a success payload or a typed error.
 *
 * @param <T> payload type
 */
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CreditResult<T> {

    private final T value;
    private final CreditError error;

    public static <T> CreditResult<T> success(T value) {
        return new CreditResult<>(value, null);
    }

    public static <T> CreditResult<T> failure(CreditError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new CreditResult<>(null, error);
    }

    public static <T> CreditResult<T> failure(ErrorCode code, String message) {
        return failure(CreditError.of(code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present, operation failed with " + error.getCode());
        }
        return value;
    }

    public CreditError getError() {
        if (error == null) {
            throw new NoSuchElementException("No error present, operation succeeded");
        }
        return error;
    }

    /**
     * True when the operation failed with the given code.
     */
    public boolean failedWith(ErrorCode code) {
        return error != null && error.getCode() == code;
    }
}

package com.creditengine.api.dto;

import com.creditengine.common.CreditError;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Map;

/**
 * Error body returned by the REST API.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String code;
    String message;
    boolean retryable;

    /**
     * Field-level validation messages, when the request body was invalid.
     */
    Map<String, String> fieldErrors;

    public static ErrorResponse from(CreditError error) {
        return new ErrorResponse(error.getCode().name(), error.getMessage(), error.isRetryable(), null);
    }
}

package com.creditengine.api.controller;

import com.creditengine.api.dto.ErrorResponse;
import com.creditengine.common.CreditError;
import com.creditengine.common.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CreditOperationException.class)
    public ResponseEntity<ErrorResponse> handleCreditOperation(CreditOperationException e) {
        CreditError error = e.getError();
        return ResponseEntity.status(statusFor(error.getCode())).body(ErrorResponse.from(error));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(
            ErrorCode.INVALID_OPERATION.name(), "Request validation failed", false, errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_OPERATION, "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
            "An unexpected error occurred");
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_OPERATION -> HttpStatus.BAD_REQUEST;
            case INVALID_PURCHASE, REFERRAL_NOT_VALID, INSUFFICIENT_CREDITS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case BALANCE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DAILY_BONUS_ALREADY_CLAIMED, OPERATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case TRANSACTION_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, ErrorCode code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code.name(), message, code.isRetryable(), null));
    }
}

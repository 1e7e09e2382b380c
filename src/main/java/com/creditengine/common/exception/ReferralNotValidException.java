package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

/**
 * Thrown when a referral violates a domain rule.
 */
public class ReferralNotValidException extends CreditEngineException {

    public ReferralNotValidException(String message) {
        super(ErrorCode.REFERRAL_NOT_VALID, message);
    }
}

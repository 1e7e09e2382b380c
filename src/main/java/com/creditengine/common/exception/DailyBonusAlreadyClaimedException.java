package com.creditengine.common.exception;

import com.creditengine.common.ErrorCode;

import java.time.LocalDate;

/**
 * Thrown when the daily bonus was already claimed for the current date.
 */
public class DailyBonusAlreadyClaimedException extends CreditEngineException {

    public DailyBonusAlreadyClaimedException(String userId, LocalDate claimDate) {
        super(ErrorCode.DAILY_BONUS_ALREADY_CLAIMED,
            String.format("Daily bonus already claimed by user %s on %s", userId, claimDate));
    }
}

package com.creditengine.orchestrator;

import com.creditengine.ledger.TransactionView;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DailyBonusClaimResult {
    String userId;
    LocalDate claimDate;
    long bonusAmount;
    int streak;
    long newBalance;
    TransactionView transaction;
}

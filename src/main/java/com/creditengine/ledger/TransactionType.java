package com.creditengine.ledger;

/**
 * Types of credit ledger transactions.
 *
 * The sign of the amount is fixed by the type: credits in are positive,
 * credits out are negative.
 */
public enum TransactionType {
    /**
     * Credits granted by the application (welcome credits, rewards).
     */
    GRANT(true),

    /**
     * Credits consumed by the user.
     */
    SPEND(false),

    /**
     * Credits bought through an in-app purchase.
     */
    PURCHASE(true),

    /**
     * Daily bonus claim.
     */
    DAILY_BONUS(true),

    /**
     * Referral payout to either the referrer or the referee.
     */
    REFERRAL(true),

    /**
     * Manual credit by an administrator.
     */
    ADMIN_ADD(true),

    /**
     * Manual debit by an administrator.
     */
    ADMIN_DEDUCT(false);

    private final boolean credit;

    TransactionType(boolean credit) {
        this.credit = credit;
    }

    public boolean isCredit() {
        return credit;
    }

    public boolean isAdmin() {
        return this == ADMIN_ADD || this == ADMIN_DEDUCT;
    }

    /**
     * Signed ledger amount for a positive magnitude.
     */
    public long signed(long magnitude) {
        return credit ? magnitude : -magnitude;
    }
}

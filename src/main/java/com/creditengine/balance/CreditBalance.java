package com.creditengine.balance;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Maintained balance projection for one user.
 *
 * totalCredits always equals the sum of the user's ledger amounts. The row is
 * only changed inside the same database transaction as the ledger append.
 */
@Entity
@Table(name = "credit_balances")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditBalance {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "total_credits", nullable = false)
    private long totalCredits;

    @Column(name = "lifetime_earned", nullable = false)
    private long lifetimeEarned;

    @Column(name = "lifetime_spent", nullable = false)
    private long lifetimeSpent;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CreditBalance(String userId, Instant now) {
        this.userId = userId;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Apply a signed ledger amount.
     */
    public void apply(long delta, Instant now) {
        this.totalCredits = Math.addExact(totalCredits, delta);
        if (delta > 0) {
            this.lifetimeEarned = Math.addExact(lifetimeEarned, delta);
        } else {
            this.lifetimeSpent = Math.addExact(lifetimeSpent, -delta);
        }
        this.updatedAt = now;
    }

    /**
     * Overwrite the cached figures with values recomputed from the ledger.
     */
    public void resetTo(long ledgerTotal, long ledgerEarned, long ledgerSpent, Instant now) {
        this.totalCredits = ledgerTotal;
        this.lifetimeEarned = ledgerEarned;
        this.lifetimeSpent = ledgerSpent;
        this.updatedAt = now;
    }
}

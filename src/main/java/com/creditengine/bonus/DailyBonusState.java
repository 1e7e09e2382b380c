package com.creditengine.bonus;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-user daily bonus claim state.
 *
 * Dates are calendar dates in the reference timezone, not timestamps.
 */
@Entity
@Table(name = "daily_bonus_states")
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DailyBonusState {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "last_claim_date")
    private LocalDate lastClaimDate;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "next_eligible_date")
    private LocalDate nextEligibleDate;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public DailyBonusState(String userId, Instant now) {
        this.userId = userId;
        this.currentStreak = 0;
        this.updatedAt = now;
    }

    /**
     * Whether a claim on the given date is allowed.
     */
    public boolean canClaimOn(LocalDate date) {
        return lastClaimDate == null || date.isAfter(lastClaimDate);
    }

    /**
     * Streak that still counts on the given date: the current streak if the
     * last claim was that day or the day before, otherwise zero.
     */
    public int effectiveStreakOn(LocalDate date) {
        if (lastClaimDate == null) {
            return 0;
        }
        if (!date.isAfter(lastClaimDate) || date.equals(lastClaimDate.plusDays(1))) {
            return currentStreak;
        }
        return 0;
    }

    /**
     * Record a claim. Consecutive days extend the streak; any larger gap restarts it at 1.
     */
    public void recordClaim(LocalDate claimDate, Instant now) {
        if (!canClaimOn(claimDate)) {
            throw new IllegalStateException("Claim date " + claimDate + " is not after " + lastClaimDate);
        }
        this.currentStreak = effectiveStreakOn(claimDate) + 1;
        this.lastClaimDate = claimDate;
        this.nextEligibleDate = claimDate.plusDays(1);
        this.updatedAt = now;
    }
}

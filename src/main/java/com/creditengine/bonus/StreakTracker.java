package com.creditengine.bonus;

import com.creditengine.common.exception.DailyBonusAlreadyClaimedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Tracks daily bonus streaks.
 *
 * Claim transitions:
 * - claim date is the day after the last claim: streak + 1
 * - claim date equals the last claim date: rejected
 * - any larger gap, or no previous claim: streak restarts at 1
 */
@Service
@Slf4j
public class StreakTracker {

    private final DailyBonusStateRepository stateRepository;
    private final Clock clock;
    private final ZoneId referenceZone;

    public StreakTracker(DailyBonusStateRepository stateRepository,
                         Clock clock,
                         @Value("${credit-engine.daily-bonus.zone:UTC}") String referenceZone) {
        this.stateRepository = stateRepository;
        this.clock = clock;
        this.referenceZone = ZoneId.of(referenceZone);
    }

    /**
     * Current calendar date in the reference timezone.
     */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(referenceZone));
    }

    @Transactional(readOnly = true)
    public DailyBonusStatus getStatus(String userId) {
        LocalDate today = today();

        return stateRepository.findById(userId)
            .map(state -> {
                boolean canClaim = state.canClaimOn(today);
                int streak = state.effectiveStreakOn(today);
                return DailyBonusStatus.builder()
                    .userId(userId)
                    .canClaim(canClaim)
                    .currentStreak(streak)
                    .nextBonusAmount(DailyBonusPolicy.bonusFor(streak))
                    .lastClaimDate(state.getLastClaimDate())
                    .nextEligibleDate(canClaim ? today : state.getNextEligibleDate())
                    .build();
            })
            .orElseGet(() -> DailyBonusStatus.builder()
                .userId(userId)
                .canClaim(true)
                .currentStreak(0)
                .nextBonusAmount(DailyBonusPolicy.bonusFor(0))
                .nextEligibleDate(today)
                .build());
    }

    /**
     * Advance the streak for a claim on the given date. Must run in the
     * transaction that appends the bonus to the ledger.
     *
     * @throws DailyBonusAlreadyClaimedException if the user already claimed on or after that date
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StreakAdvance claim(String userId, LocalDate claimDate) {
        DailyBonusState state = stateRepository.findById(userId)
            .orElseGet(() -> new DailyBonusState(userId, clock.instant()));

        if (!state.canClaimOn(claimDate)) {
            throw new DailyBonusAlreadyClaimedException(userId, claimDate);
        }

        int previousStreak = state.effectiveStreakOn(claimDate);
        int bonusAmount = DailyBonusPolicy.bonusFor(previousStreak);

        state.recordClaim(claimDate, clock.instant());
        stateRepository.save(state);

        log.info("Daily bonus streak for user {} advanced {} -> {} on {}",
            userId, previousStreak, state.getCurrentStreak(), claimDate);

        return new StreakAdvance(userId, claimDate, previousStreak, state.getCurrentStreak(), bonusAmount);
    }
}

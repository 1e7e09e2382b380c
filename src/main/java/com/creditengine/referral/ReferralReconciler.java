package com.creditengine.referral;

import com.creditengine.common.exception.CreditEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds referrals left PENDING by an interrupted payout and settles them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferralReconciler {

    private final ReferralRepository referralRepository;
    private final ReferralProcessor referralProcessor;
    private final Clock clock;

    public ReferralReconciliationReport resumeStale(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<Referral> stale = referralRepository
            .findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ReferralStatus.PENDING, cutoff);

        int completed = 0;
        List<String> failed = new ArrayList<>();

        for (Referral referral : stale) {
            try {
                referralProcessor.settle(referral);
                completed++;
            } catch (CreditEngineException | DataAccessException e) {
                log.warn("Could not settle pending referral {}: {}", referral.getId(), e.getMessage());
                failed.add(referral.getId());
            }
        }

        if (!stale.isEmpty()) {
            log.info("Referral reconciliation: {} pending, {} completed, {} failed",
                stale.size(), completed, failed.size());
        }

        return new ReferralReconciliationReport(stale.size(), completed, List.copyOf(failed));
    }
}

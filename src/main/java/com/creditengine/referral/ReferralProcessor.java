package com.creditengine.referral;

import com.creditengine.common.IdempotencyKey;
import com.creditengine.common.InputLimits;
import com.creditengine.common.exception.InvalidOperationException;
import com.creditengine.common.exception.ReferralNotValidException;
import com.creditengine.idempotency.IdempotentOperation;
import com.creditengine.ledger.CreditTransaction;
import com.creditengine.ledger.TransactionType;
import com.creditengine.orchestrator.CreditWriter;
import com.creditengine.orchestrator.Posting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Pays out referrals.
 *
 * Flow:
 * 1. Record the referral as PENDING (one per referee) and commit
 * 2. Credit the referee, keyed by referral:{id}:referee
 * 3. Credit the referrer, keyed by referral:{id}:referrer
 * 4. Mark the referral COMPLETED
 *
 * The legs are separate single-user writes. If the process stops between
 * them, the PENDING row remains and settling it again writes only the
 * missing leg.
 */
@Service
@Slf4j
public class ReferralProcessor {

    static final String REFEREE_LEG = "referee";
    static final String REFERRER_LEG = "referrer";

    private final ReferralRepository referralRepository;
    private final CreditWriter creditWriter;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public ReferralProcessor(ReferralRepository referralRepository,
                             CreditWriter creditWriter,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.referralRepository = referralRepository;
        this.creditWriter = creditWriter;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public ReferralResult process(ReferralRequest request) {
        validate(request);
        Referral referral = register(request);
        return settle(referral);
    }

    /**
     * Write whichever legs are missing and mark the referral COMPLETED.
     */
    public ReferralResult settle(Referral referral) {
        Posting refereeLeg = payLeg(referral, REFEREE_LEG, referral.getRefereeUserId(),
            referral.getRefereeCredits(), referral.getReferrerUserId());
        Posting referrerLeg = payLeg(referral, REFERRER_LEG, referral.getReferrerUserId(),
            referral.getReferrerCredits(), referral.getRefereeUserId());

        String refereeTxId = refereeLeg.getTransaction().getId();
        String referrerTxId = referrerLeg.getTransaction().getId();

        transactionTemplate.executeWithoutResult(status -> referralRepository.findById(referral.getId())
            .filter(current -> !current.isCompleted())
            .ifPresent(current -> {
                current.complete(refereeTxId, referrerTxId, clock.instant());
                referralRepository.save(current);
            }));

        log.info("Referral {} completed: referee {} +{}, referrer {} +{}",
            referral.getId(), referral.getRefereeUserId(), referral.getRefereeCredits(),
            referral.getReferrerUserId(), referral.getReferrerCredits());

        return ReferralResult.builder()
            .referralId(referral.getId())
            .referrerUserId(referral.getReferrerUserId())
            .refereeUserId(referral.getRefereeUserId())
            .referrerCredits(referral.getReferrerCredits())
            .refereeCredits(referral.getRefereeCredits())
            .referrerTransactionId(referrerTxId)
            .refereeTransactionId(refereeTxId)
            .build();
    }

    private void validate(ReferralRequest request) {
        if (request == null) {
            throw new InvalidOperationException("Referral request is required");
        }
        InputLimits.requireId(request.getReferrerUserId(), "Referrer user ID");
        InputLimits.requireId(request.getRefereeUserId(), "Referee user ID");
        InputLimits.requireId(request.getReferralCode(), "Referral code");
        if (request.getType() == null) {
            throw new InvalidOperationException("Referral type is required");
        }
        if (request.getReferrerUserId().equals(request.getRefereeUserId())) {
            throw new ReferralNotValidException("Users cannot refer themselves");
        }
    }

    private Referral register(ReferralRequest request) {
        try {
            return transactionTemplate.execute(status -> referralRepository
                .findByRefereeUserId(request.getRefereeUserId())
                .map(existing -> resume(existing, request))
                .orElseGet(() -> referralRepository.saveAndFlush(new Referral(
                    request.getReferrerUserId(),
                    request.getRefereeUserId(),
                    request.getReferralCode(),
                    request.getType(),
                    clock.instant()))));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent referral registration for referee {}", request.getRefereeUserId());
            return transactionTemplate.execute(status -> referralRepository
                .findByRefereeUserId(request.getRefereeUserId())
                .map(existing -> resume(existing, request))
                .orElseThrow(() -> e));
        }
    }

    private Referral resume(Referral existing, ReferralRequest request) {
        if (existing.isCompleted()) {
            throw new ReferralNotValidException(
                "User " + request.getRefereeUserId() + " has already used a referral code");
        }
        if (!existing.matches(request)) {
            throw new ReferralNotValidException(
                "User " + request.getRefereeUserId() + " already has a pending referral");
        }
        log.info("Resuming pending referral {}", existing.getId());
        return existing;
    }

    private Posting payLeg(Referral referral, String leg, String userId, long credits, String counterpartyUserId) {
        String key = IdempotencyKey.forReferralLeg(referral.getId(), leg);

        return creditWriter.postOnce(userId, key, IdempotentOperation.REFERRAL,
            () -> new ReferralNotValidException("Referral payout " + key + " belongs to another user"),
            () -> new CreditTransaction(
                userId,
                TransactionType.REFERRAL,
                TransactionType.REFERRAL.signed(credits),
                "Referral bonus - " + referral.getType().name().toLowerCase(),
                Map.of(
                    "referralId", referral.getId(),
                    "referralCode", referral.getReferralCode(),
                    "role", leg,
                    "counterpartyUserId", counterpartyUserId
                ),
                key,
                clock.instant()
            ));
    }
}

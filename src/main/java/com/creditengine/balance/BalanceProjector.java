package com.creditengine.balance;

import com.creditengine.common.exception.BalanceNotFoundException;
import com.creditengine.common.exception.InsufficientCreditsException;
import com.creditengine.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the per-user balance cache and audits it against the ledger.
 *
 * Fast reads come from the cache. Writes lock the balance row and must run in
 * the same transaction as the ledger append they mirror. The fold and
 * reconcile operations recompute balances from the ledger to detect drift.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceProjector {

    private final CreditBalanceRepository balanceRepository;
    private final LedgerService ledgerService;
    private final Clock clock;

    /**
     * Fast, lock-free read of the cached balance. May trail an in-flight write.
     */
    @Transactional(readOnly = true)
    public BalanceView getBalance(String userId) {
        return balanceRepository.findById(userId)
            .map(BalanceView::from)
            .orElseThrow(() -> new BalanceNotFoundException(userId));
    }

    @Transactional(readOnly = true)
    public Optional<BalanceView> findBalance(String userId) {
        return balanceRepository.findById(userId).map(BalanceView::from);
    }

    /**
     * Apply a signed ledger amount to the user's cached balance.
     * Creates the projection on the first credit.
     *
     * @throws BalanceNotFoundException if a debit targets a user without history
     * @throws InsufficientCreditsException if the balance would go negative
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CreditBalance apply(String userId, long delta) {
        Instant now = clock.instant();

        CreditBalance balance = balanceRepository.findByUserIdForUpdate(userId).orElse(null);
        if (balance == null) {
            if (delta < 0) {
                throw new BalanceNotFoundException(userId);
            }
            balance = new CreditBalance(userId, now);
        }

        if (balance.getTotalCredits() + delta < 0) {
            throw new InsufficientCreditsException(userId, -delta, balance.getTotalCredits());
        }

        balance.apply(delta, now);
        CreditBalance saved = balanceRepository.save(balance);

        log.debug("Balance for user {} is now {} (delta {})", userId, saved.getTotalCredits(), delta);
        return saved;
    }

    /**
     * Recompute the balance from the ledger.
     */
    @Transactional(readOnly = true)
    public long foldBalance(String userId) {
        return ledgerService.sumForUser(userId);
    }

    /**
     * Compare the cache with the ledger fold for one user. With repair the total
     * and the lifetime figures are reset to the ledger values under the row lock.
     */
    @Transactional
    public ReconciliationResult reconcile(String userId, boolean repair) {
        CreditBalance balance = balanceRepository.findByUserIdForUpdate(userId).orElse(null);
        long ledgerBalance = ledgerService.sumForUser(userId);

        boolean missing = balance == null;
        if (missing) {
            if (!ledgerService.hasHistory(userId)) {
                throw new BalanceNotFoundException(userId);
            }
            balance = new CreditBalance(userId, clock.instant());
        }

        long ledgerEarned = ledgerService.earnedForUser(userId);
        long ledgerSpent = ledgerService.spentForUser(userId);

        long cached = balance.getTotalCredits();
        long drift = cached - ledgerBalance;
        boolean lifetimeDrift = balance.getLifetimeEarned() != ledgerEarned
            || balance.getLifetimeSpent() != ledgerSpent;
        boolean repaired = false;

        if (drift != 0 || missing || lifetimeDrift) {
            log.warn("Balance drift for user {}: cached={}, ledger={}, drift={}, lifetime drift={}, projection missing={}",
                userId, cached, ledgerBalance, drift, lifetimeDrift, missing);
            if (repair) {
                balance.resetTo(ledgerBalance, ledgerEarned, ledgerSpent, clock.instant());
                balanceRepository.save(balance);
                repaired = true;
                log.info("Repaired balance for user {} to {}", userId, ledgerBalance);
            }
        }

        return new ReconciliationResult(userId, cached, ledgerBalance, drift, repaired);
    }

    /**
     * Reconcile every user that has a ledger history or a cached balance.
     */
    @Transactional
    public ReconciliationSummary reconcileAll(boolean repair) {
        Set<String> userIds = new TreeSet<>(ledgerService.findUsersWithHistory());
        balanceRepository.findAll().forEach(balance -> userIds.add(balance.getUserId()));

        List<ReconciliationResult> driftResults = new ArrayList<>();
        long totalDrift = 0;

        for (String userId : userIds) {
            ReconciliationResult result = reconcile(userId, repair);
            if (!result.isBalanced()) {
                driftResults.add(result);
                totalDrift += Math.abs(result.drift());
            }
        }

        log.info("Reconciled {} users, {} with drift (total {})", userIds.size(), driftResults.size(), totalDrift);

        return new ReconciliationSummary(
            userIds.size(),
            userIds.size() - driftResults.size(),
            driftResults.size(),
            totalDrift,
            List.copyOf(driftResults)
        );
    }
}

package com.creditengine.orchestrator;

import com.creditengine.balance.BalanceProjector;
import com.creditengine.balance.BalanceView;
import com.creditengine.balance.CreditBalance;
import com.creditengine.common.exception.CreditEngineException;
import com.creditengine.common.exception.TransactionFailedException;
import com.creditengine.idempotency.IdempotencyGuard;
import com.creditengine.idempotency.IdempotentOperation;
import com.creditengine.idempotency.Reservation;
import com.creditengine.ledger.CreditTransaction;
import com.creditengine.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Writes ledger entries for one user at a time.
 *
 * Every write holds the user's lock and runs one bounded transaction in which
 * the balance row is locked and updated, the entry is appended and, for keyed
 * writes, the idempotency record is completed. Either all of it commits or
 * none of it does.
 */
@Component
@Slf4j
public class CreditWriter {

    private final UserLockManager lockManager;
    private final IdempotencyGuard idempotencyGuard;
    private final LedgerService ledgerService;
    private final BalanceProjector balanceProjector;
    private final TransactionTemplate transactionTemplate;

    public CreditWriter(UserLockManager lockManager,
                        IdempotencyGuard idempotencyGuard,
                        LedgerService ledgerService,
                        BalanceProjector balanceProjector,
                        PlatformTransactionManager transactionManager,
                        @Value("${credit-engine.storage.transaction-timeout:PT10S}") Duration transactionTimeout) {
        this.lockManager = lockManager;
        this.idempotencyGuard = idempotencyGuard;
        this.ledgerService = ledgerService;
        this.balanceProjector = balanceProjector;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) Math.max(1, transactionTimeout.toSeconds()));
    }

    /**
     * Append an entry built inside the transaction.
     */
    public Posting post(String userId, Supplier<CreditTransaction> entry) {
        return lockManager.executeLocked(userId, () -> write(userId, entry, null));
    }

    /**
     * Append an entry at most once per key. A completed key replays the
     * transaction it produced. The entry supplier runs inside the transaction,
     * so derived state it touches commits together with the entry.
     *
     * @param foreignKeyError raised when the key belongs to another user
     */
    public Posting postOnce(String userId, String key, IdempotentOperation operation,
                            Supplier<? extends CreditEngineException> foreignKeyError,
                            Supplier<CreditTransaction> entry) {
        return lockManager.executeLocked(userId, () -> {
            Reservation reservation = idempotencyGuard.reserve(key, userId, operation);

            if (reservation.isForeign()) {
                throw foreignKeyError.get();
            }
            if (reservation.isReplay()) {
                return replay(reservation);
            }

            try {
                return write(userId, entry, key);
            } catch (RuntimeException e) {
                release(key, e);
                throw e;
            }
        });
    }

    private Posting write(String userId, Supplier<CreditTransaction> entry, String key) {
        return transactionTemplate.execute(status -> {
            CreditTransaction transaction = entry.get();
            if (!transaction.getUserId().equals(userId)) {
                throw new IllegalStateException("Entry for user " + transaction.getUserId()
                    + " written under lock for user " + userId);
            }

            CreditBalance balance = balanceProjector.apply(userId, transaction.getAmount());
            ledgerService.append(transaction);
            if (key != null) {
                idempotencyGuard.complete(key, transaction.getId());
            }

            return Posting.posted(transaction, BalanceView.from(balance));
        });
    }

    private Posting replay(Reservation reservation) {
        String transactionId = reservation.getResultingTransactionId();
        CreditTransaction transaction = ledgerService.findById(transactionId)
            .orElseThrow(() -> new TransactionFailedException(
                "Idempotency key " + reservation.getKey() + " points at missing transaction " + transactionId));

        log.info("Replaying transaction {} for idempotency key {}", transactionId, reservation.getKey());
        return Posting.replayed(transaction);
    }

    private void release(String key, RuntimeException cause) {
        try {
            idempotencyGuard.release(key);
        } catch (DataAccessException e) {
            log.warn("Could not release idempotency key {}; it becomes retryable after the pending timeout", key, e);
            cause.addSuppressed(e);
        }
    }
}

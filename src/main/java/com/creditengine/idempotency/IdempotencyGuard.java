package com.creditengine.idempotency;

import com.creditengine.common.IdempotencyKey;
import com.creditengine.common.exception.OperationInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Deduplicates externally triggered operations by a caller-supplied key.
 *
 * Flow:
 * 1. reserve() durably claims the key in its own transaction
 * 2. the caller appends to the ledger and calls complete() in that same transaction
 * 3. on failure the caller calls release() so the key can be retried
 *
 * A reservation left PENDING by a crash becomes retryable after the pending timeout.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private final IdempotencyRecordRepository recordRepository;
    private final Clock clock;
    private final TransactionTemplate requiresNew;
    private final Duration pendingTimeout;

    public IdempotencyGuard(IdempotencyRecordRepository recordRepository,
                            Clock clock,
                            PlatformTransactionManager transactionManager,
                            @Value("${credit-engine.idempotency.pending-timeout:PT30S}") Duration pendingTimeout) {
        this.recordRepository = recordRepository;
        this.clock = clock;
        this.pendingTimeout = pendingTimeout;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Reserve a key for a user.
     *
     * @return ACQUIRED if the caller must perform the operation, COMPLETED if it
     *         already happened, FOREIGN if another user owns the key
     * @throws OperationInProgressException if a live reservation exists
     */
    public Reservation reserve(String key, String userId, IdempotentOperation operation) {
        IdempotencyKey.validate(key);

        try {
            return requiresNew.execute(status -> reserveInTransaction(key, userId, operation));
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race against another request for the same key
            log.info("Concurrent reservation detected for key {}", key);
            return requiresNew.execute(status -> recordRepository.findById(key)
                .map(existing -> resolveExisting(existing, userId))
                .orElseThrow(() -> new OperationInProgressException(key)));
        } catch (OptimisticLockingFailureException e) {
            log.info("Concurrent takeover detected for key {}", key);
            throw new OperationInProgressException(key);
        }
    }

    private Reservation reserveInTransaction(String key, String userId, IdempotentOperation operation) {
        Optional<IdempotencyRecord> existing = recordRepository.findById(key);
        if (existing.isPresent()) {
            return resolveExisting(existing.get(), userId);
        }

        IdempotencyRecord record = recordRepository.saveAndFlush(
            new IdempotencyRecord(key, userId, operation, clock.instant()));

        log.debug("Reserved idempotency key {} for user {} ({})", key, userId, operation);
        return Reservation.acquired(record);
    }

    private Reservation resolveExisting(IdempotencyRecord record, String userId) {
        if (!record.getUserId().equals(userId)) {
            log.warn("Idempotency key {} owned by user {} was presented by user {}",
                record.getKey(), record.getUserId(), userId);
            return Reservation.foreign(record);
        }

        if (record.isCompleted()) {
            log.info("Duplicate request with idempotency key {}", record.getKey());
            return Reservation.completed(record);
        }

        Instant now = clock.instant();
        if (record.isStale(now, pendingTimeout)) {
            log.warn("Taking over stale reservation {} (reserved at {})", record.getKey(), record.getReservedAt());
            record.refreshReservation(now);
            return Reservation.acquired(recordRepository.saveAndFlush(record));
        }

        throw new OperationInProgressException(record.getKey());
    }

    /**
     * Link a reservation to the transaction it produced. Must join the ledger transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void complete(String key, String transactionId) {
        IdempotencyRecord record = recordRepository.findById(key)
            .orElseThrow(() -> new IllegalStateException("No reservation for idempotency key: " + key));
        record.complete(transactionId, clock.instant());
        recordRepository.save(record);

        log.debug("Completed idempotency key {} with transaction {}", key, transactionId);
    }

    /**
     * Drop a PENDING reservation after the guarded operation failed.
     */
    @Transactional
    public void release(String key) {
        recordRepository.findById(key)
            .filter(record -> !record.isCompleted())
            .ifPresent(record -> {
                recordRepository.delete(record);
                log.debug("Released idempotency key {}", key);
            });
    }
}

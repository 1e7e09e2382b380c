package com.creditengine.idempotency;

import com.creditengine.common.exception.InvalidOperationException;
import com.creditengine.common.exception.OperationInProgressException;
import com.creditengine.support.MutableClock;
import com.creditengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the idempotency guard's reservation lifecycle.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class IdempotencyGuardTest {

    @Autowired
    private IdempotencyGuard idempotencyGuard;

    @Autowired
    private IdempotencyRecordRepository recordRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private MutableClock clock;

    private String key;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-03-01T10:00:00Z"));
        key = "purchase:" + UUID.randomUUID();
    }

    @Test
    void testFirstReservationAcquires() {
        Reservation reservation = idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        assertTrue(reservation.isNew());
        IdempotencyRecord record = recordRepository.findById(key).orElseThrow();
        assertEquals(IdempotencyRecord.Status.PENDING, record.getStatus());
        assertEquals("user-1", record.getUserId());
    }

    @Test
    void testLiveReservationBlocksSecondRequest() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        OperationInProgressException e = assertThrows(OperationInProgressException.class,
            () -> idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE));
        assertTrue(e.isRetryable());
    }

    @Test
    void testStaleReservationTakenOver() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        clock.advance(Duration.ofSeconds(31));
        Reservation takeover = idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        assertTrue(takeover.isNew());
        assertEquals(clock.instant(), recordRepository.findById(key).orElseThrow().getReservedAt());
    }

    @Test
    void testCompletedReservationReplays() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);
        new TransactionTemplate(transactionManager)
            .executeWithoutResult(status -> idempotencyGuard.complete(key, "tx-1"));

        Reservation replay = idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        assertTrue(replay.isReplay());
        assertEquals("tx-1", replay.getResultingTransactionId());

        // Completed keys never expire
        clock.advance(Duration.ofDays(30));
        assertTrue(idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE).isReplay());
    }

    @Test
    void testKeyOwnedByAnotherUser() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        Reservation foreign = idempotencyGuard.reserve(key, "user-2", IdempotentOperation.PURCHASE);

        assertTrue(foreign.isForeign());
        assertEquals("user-1", recordRepository.findById(key).orElseThrow().getUserId());
    }

    @Test
    void testReleaseAllowsRetry() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        idempotencyGuard.release(key);

        assertTrue(recordRepository.findById(key).isEmpty());
        assertTrue(idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE).isNew());
    }

    @Test
    void testReleaseKeepsCompletedRecord() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);
        new TransactionTemplate(transactionManager)
            .executeWithoutResult(status -> idempotencyGuard.complete(key, "tx-1"));

        idempotencyGuard.release(key);

        assertTrue(recordRepository.findById(key).orElseThrow().isCompleted());
    }

    @Test
    void testCompleteRequiresTransaction() {
        idempotencyGuard.reserve(key, "user-1", IdempotentOperation.PURCHASE);

        assertThrows(IllegalTransactionStateException.class, () -> idempotencyGuard.complete(key, "tx-1"));
    }

    @Test
    void testBlankKeyRejected() {
        assertThrows(InvalidOperationException.class,
            () -> idempotencyGuard.reserve(" ", "user-1", IdempotentOperation.PURCHASE));
    }
}

package com.creditengine.orchestrator;

import com.creditengine.balance.BalanceView;
import com.creditengine.common.CreditResult;
import com.creditengine.common.ErrorCode;
import com.creditengine.ledger.CreditTransactionRepository;
import com.creditengine.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent writes for one user must serialize without losing updates.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class ConcurrentDeductionTest {

    private static final int THREADS = 100;

    @Autowired
    private CreditOrchestrator creditOrchestrator;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Test
    void testHundredConcurrentDeductionsDrainBalanceExactly() throws Exception {
        String userId = "user-" + UUID.randomUUID();
        creditOrchestrator.addCredits(userId, THREADS, "Starting balance");

        List<CreditResult<BalanceView>> results = runConcurrently(THREADS,
            () -> creditOrchestrator.deductCredits(userId, 1, "Concurrent spend"));

        assertTrue(results.stream().allMatch(CreditResult::isSuccess));
        assertEquals(0, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
        assertEquals(0, transactionRepository.sumAmountByUserId(userId));
        assertEquals(THREADS + 1, transactionRepository.countByUserId(userId));
    }

    @Test
    void testOverdrawAttemptsRejectedUnderContention() throws Exception {
        String userId = "user-" + UUID.randomUUID();
        creditOrchestrator.addCredits(userId, 10, "Starting balance");

        List<CreditResult<BalanceView>> results = runConcurrently(25,
            () -> creditOrchestrator.deductCredits(userId, 1, "Concurrent spend"));

        long succeeded = results.stream().filter(CreditResult::isSuccess).count();
        long rejected = results.stream().filter(r -> r.failedWith(ErrorCode.INSUFFICIENT_CREDITS)).count();

        assertEquals(10, succeeded);
        assertEquals(15, rejected);
        assertEquals(0, creditOrchestrator.getBalance(userId).getValue().getTotalCredits());
    }

    @Test
    void testDifferentUsersProceedIndependently() throws Exception {
        List<String> users = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String userId = "user-" + UUID.randomUUID();
            creditOrchestrator.addCredits(userId, 5, "Starting balance");
            users.add(userId);
        }

        List<Future<CreditResult<BalanceView>>> futures = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(users.size());
        try {
            for (String userId : users) {
                futures.add(executor.submit(() -> creditOrchestrator.deductCredits(userId, 5, "Spend all")));
            }
            for (Future<CreditResult<BalanceView>> future : futures) {
                assertEquals(0, future.get(60, TimeUnit.SECONDS).getValue().getTotalCredits());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> List<T> runConcurrently(int threads, Callable<T> task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(120, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}

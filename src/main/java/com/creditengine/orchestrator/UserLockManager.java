package com.creditengine.orchestrator;

import com.creditengine.common.exception.TransactionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes per user within this process.
 *
 * Each user has a fair lock; different users never share one. Waiting is
 * bounded and a timeout surfaces as a retryable TRANSACTION_FAILED. A user's
 * entry lives only while some thread holds or waits for its lock.
 */
@Component
@Slf4j
public class UserLockManager {

    private final ConcurrentMap<String, UserLock> locks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;

    public UserLockManager(@Value("${credit-engine.locking.user-lock-timeout:PT5S}") Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public <T> T executeLocked(String userId, Supplier<T> work) {
        UserLock entry = locks.compute(userId, (id, existing) -> {
            UserLock userLock = existing != null ? existing : new UserLock();
            userLock.users++;
            return userLock;
        });

        try {
            return runLocked(userId, entry.lock, work);
        } finally {
            // Counter changes only inside compute, which is atomic per key
            locks.computeIfPresent(userId, (id, userLock) -> --userLock.users == 0 ? null : userLock);
        }
    }

    private <T> T runLocked(String userId, ReentrantLock lock, Supplier<T> work) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionFailedException("Interrupted while waiting for lock on user " + userId, e);
        }

        if (!acquired) {
            log.warn("Timed out after {} waiting for lock on user {}", lockTimeout, userId);
            throw new TransactionFailedException("Timed out waiting for lock on user " + userId);
        }

        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    int trackedUsers() {
        return locks.size();
    }

    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock(true);

        /**
         * Threads holding or waiting for the lock.
         */
        private int users;
    }
}

package com.creditengine.balance;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for balance projections.
 */
@Repository
public interface CreditBalanceRepository extends JpaRepository<CreditBalance, String> {

    /**
     * Find balance with pessimistic write lock. Waits at most three seconds for the row lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select b from CreditBalance b where b.userId = :userId")
    Optional<CreditBalance> findByUserIdForUpdate(@Param("userId") String userId);
}

package com.creditengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for credit ledger transactions.
 */
@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, String>,
        JpaSpecificationExecutor<CreditTransaction> {

    @Query("select coalesce(sum(t.amount), 0) from CreditTransaction t where t.userId = :userId")
    long sumAmountByUserId(@Param("userId") String userId);

    @Query("select coalesce(sum(t.amount), 0) from CreditTransaction t where t.userId = :userId and t.amount > 0")
    long sumEarnedByUserId(@Param("userId") String userId);

    @Query("select coalesce(sum(-t.amount), 0) from CreditTransaction t where t.userId = :userId and t.amount < 0")
    long sumSpentByUserId(@Param("userId") String userId);

    boolean existsByUserId(String userId);

    long countByUserId(String userId);

    @Query("select distinct t.userId from CreditTransaction t")
    List<String> findDistinctUserIds();

    @Query("select count(distinct t.userId) from CreditTransaction t")
    long countDistinctUsers();

    @Query("select coalesce(sum(t.amount), 0) from CreditTransaction t where t.amount > 0")
    long sumCreditsIssued();

    @Query("select coalesce(sum(-t.amount), 0) from CreditTransaction t where t.amount < 0")
    long sumCreditsSpent();

    long countByType(TransactionType type);
}

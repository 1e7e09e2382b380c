package com.creditengine.ledger;

import com.creditengine.common.exception.DuplicateTransactionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for the append-only credit ledger.
 *
 * The ledger is the single source of truth for balances. Appends must join the
 * caller's transaction so the balance cache update commits atomically with them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final CreditTransactionRepository transactionRepository;

    /**
     * Append a transaction to the ledger.
     *
     * @return the id of the stored transaction
     * @throws DuplicateTransactionException if the id already exists
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String append(CreditTransaction transaction) {
        if (transactionRepository.existsById(transaction.getId())) {
            throw new DuplicateTransactionException(transaction.getId());
        }

        transactionRepository.save(transaction);

        log.info("Appended {}: txn={}, user={}, amount={}",
            transaction.getType(), transaction.getId(), transaction.getUserId(), transaction.getAmount());

        return transaction.getId();
    }

    @Transactional(readOnly = true)
    public long sumForUser(String userId) {
        return transactionRepository.sumAmountByUserId(userId);
    }

    /**
     * Total credited to a user over the whole ledger.
     */
    @Transactional(readOnly = true)
    public long earnedForUser(String userId) {
        return transactionRepository.sumEarnedByUserId(userId);
    }

    /**
     * Total debited from a user, as a positive number.
     */
    @Transactional(readOnly = true)
    public long spentForUser(String userId) {
        return transactionRepository.sumSpentByUserId(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasHistory(String userId) {
        return transactionRepository.existsByUserId(userId);
    }

    @Transactional(readOnly = true)
    public Optional<CreditTransaction> findById(String transactionId) {
        return transactionRepository.findById(transactionId);
    }

    /**
     * List a user's transactions, filtered and paged (zero-based page index).
     * Sorted by createdAt in the filter's direction, then by id.
     */
    @Transactional(readOnly = true)
    public Page<CreditTransaction> listForUser(String userId, TransactionFilter filter, int pageIndex, int pageSize) {
        Sort sort = Sort.by(filter.getDirection(), "createdAt").and(Sort.by(filter.getDirection(), "id"));
        Pageable pageable = PageRequest.of(pageIndex, pageSize, sort);

        log.debug("Listing transactions for user {} with filter {} page {}", userId, filter, pageable);
        return transactionRepository.findAll(TransactionSpecifications.forUser(userId, filter), pageable);
    }

    @Transactional(readOnly = true)
    public List<String> findUsersWithHistory() {
        return transactionRepository.findDistinctUserIds();
    }
}

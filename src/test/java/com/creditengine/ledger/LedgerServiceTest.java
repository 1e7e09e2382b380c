package com.creditengine.ledger;

import com.creditengine.balance.BalanceProjector;
import com.creditengine.common.exception.DuplicateTransactionException;
import com.creditengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class LedgerServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BalanceProjector balanceProjector;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;
    private String userId;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        userId = "user-" + UUID.randomUUID();
    }

    @Test
    void testAppendRequiresSurroundingTransaction() {
        CreditTransaction transaction = entry(TransactionType.GRANT, 10, T0);

        assertThrows(IllegalTransactionStateException.class, () -> ledgerService.append(transaction));
        assertFalse(ledgerService.hasHistory(userId));
    }

    @Test
    void testAppendAndSum() {
        write(entry(TransactionType.GRANT, 50, T0));
        write(entry(TransactionType.SPEND, -20, T0.plusSeconds(60)));

        assertTrue(ledgerService.hasHistory(userId));
        assertEquals(30, ledgerService.sumForUser(userId));
        assertEquals(0, ledgerService.sumForUser("user-" + UUID.randomUUID()));
        assertTrue(ledgerService.findUsersWithHistory().contains(userId));
    }

    @Test
    void testDuplicateIdRejected() {
        CreditTransaction transaction = entry(TransactionType.GRANT, 10, T0);
        write(transaction);

        assertThrows(DuplicateTransactionException.class,
            () -> transactionTemplate.executeWithoutResult(status -> ledgerService.append(transaction)));
        assertEquals(10, ledgerService.sumForUser(userId));
    }

    @Test
    void testStoredTransactionKeepsMetadata() {
        CreditTransaction transaction = new CreditTransaction(userId, TransactionType.PURCHASE, 38, "Purchase: Popular Pack",
            Map.of("productId", "credits_popular", "bonusCredits", "3"), "purchase:" + UUID.randomUUID(), T0);
        write(transaction);

        CreditTransaction stored = ledgerService.findById(transaction.getId()).orElseThrow();
        assertEquals("credits_popular", stored.metadataValue("productId"));
        assertEquals("3", stored.metadataValue("bonusCredits"));
        assertEquals(transaction.getIdempotencyKey(), stored.getIdempotencyKey());
    }

    @Test
    void testListFiltersAndSorts() {
        write(entry(TransactionType.GRANT, 50, T0));
        write(entry(TransactionType.SPEND, -5, T0.plusSeconds(60)));
        write(entry(TransactionType.DAILY_BONUS, 10, T0.plusSeconds(120)));
        write(entry(TransactionType.SPEND, -7, T0.plusSeconds(180)));

        Page<CreditTransaction> newestFirst = ledgerService.listForUser(userId, TransactionFilter.none(), 0, 3);
        assertEquals(4, newestFirst.getTotalElements());
        assertEquals(2, newestFirst.getTotalPages());
        assertEquals(-7, newestFirst.getContent().get(0).getAmount());

        TransactionFilter spendsAscending = TransactionFilter.builder()
            .type(TransactionType.SPEND)
            .direction(Sort.Direction.ASC)
            .build();
        List<Long> spends = ledgerService.listForUser(userId, spendsAscending, 0, 10).getContent().stream()
            .map(CreditTransaction::getAmount)
            .toList();
        assertEquals(List.of(-5L, -7L), spends);

        TransactionFilter window = TransactionFilter.builder()
            .from(T0.plusSeconds(60))
            .to(T0.plusSeconds(120))
            .build();
        assertEquals(2, ledgerService.listForUser(userId, window, 0, 10).getTotalElements());
    }

    private void write(CreditTransaction transaction) {
        transactionTemplate.executeWithoutResult(status -> {
            balanceProjector.apply(userId, transaction.getAmount());
            ledgerService.append(transaction);
        });
    }

    private CreditTransaction entry(TransactionType type, long amount, Instant createdAt) {
        return new CreditTransaction(userId, type, amount, type.name().toLowerCase(), Map.of(), null, createdAt);
    }
}

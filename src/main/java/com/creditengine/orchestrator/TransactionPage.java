package com.creditengine.orchestrator;

import com.creditengine.ledger.TransactionView;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One page of a user's transaction history.
 */
@Value
@Builder
public class TransactionPage {
    List<TransactionView> transactions;

    /**
     * The same transactions keyed by UTC date (yyyy-MM-dd), in page order.
     */
    Map<String, List<TransactionView>> transactionsByDate;

    long totalCount;

    /**
     * 1-based.
     */
    int currentPage;

    int totalPages;
    boolean hasMore;
}

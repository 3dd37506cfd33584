package com.chainindexer.query;

import java.time.Instant;

public record BlockSummaryView(
        long blockNumber,
        int transactions,
        int processedTransactions,
        int skippedTransactions,
        int erroredTransactions,
        int events,
        int positions,
        int errors,
        Instant completedAt
) {
}

package com.chainindexer.api.dto;

import java.time.Instant;

public record BlockSummaryResponse(
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

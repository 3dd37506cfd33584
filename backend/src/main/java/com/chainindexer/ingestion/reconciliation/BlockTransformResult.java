package com.chainindexer.ingestion.reconciliation;

import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransformedTransaction;

import java.util.List;

/**
 * Transformed transactions of one block, in the order they were handed in.
 */
public record BlockTransformResult(long blockNumber, List<TransformedTransaction> transactions) {

    public BlockTransformResult {
        transactions = List.copyOf(transactions);
    }

    public BlockTransformSummary summary() {
        int skipped = 0;
        int errored = 0;
        int events = 0;
        int positions = 0;
        int errors = 0;
        for (TransformedTransaction tx : transactions) {
            if (isSkipped(tx.transaction())) {
                skipped++;
            }
            if (!tx.errors().isEmpty()) {
                errored++;
            }
            events += tx.events().size();
            positions += tx.positions().size();
            errors += tx.errors().size();
        }
        return new BlockTransformSummary(blockNumber, transactions.size(), transactions.size() - skipped, skipped,
                errored, events, positions, errors);
    }

    static boolean isSkipped(Transaction tx) {
        return !tx.txSuccess() || tx.decodedLogs().isEmpty();
    }
}

package com.chainindexer.ingestion.reconciliation;

/**
 * Counts for one transformed block.
 *
 * @param transactions          transactions handed in
 * @param processed             transactions that went through both phases
 * @param skipped               passed through untouched (reverted or nothing decoded)
 * @param erroredTransactions   transactions with at least one ProcessingError
 */
public record BlockTransformSummary(
        long blockNumber,
        int transactions,
        int processed,
        int skipped,
        int erroredTransactions,
        int events,
        int positions,
        int errors
) {
}

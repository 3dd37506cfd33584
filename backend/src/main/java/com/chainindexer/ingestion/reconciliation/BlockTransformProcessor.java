package com.chainindexer.ingestion.reconciliation;

import com.chainindexer.config.AsyncConfig;
import com.chainindexer.domain.Transaction;
import com.chainindexer.domain.TransformedTransaction;
import com.chainindexer.ingestion.config.TransformProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Fans the transactions of one block out to the transform executor and collects the results in input order.
 * Transactions are independent, so at most {@code parallelism} of them run at once and nothing is shared.
 */
@Component
@Slf4j
public class BlockTransformProcessor {

    private final ReconciliationEngine engine;
    private final TransformProperties properties;
    private final Executor executor;

    public BlockTransformProcessor(ReconciliationEngine engine, TransformProperties properties,
                                   @Qualifier(AsyncConfig.TRANSFORM_EXECUTOR) Executor executor) {
        this.engine = engine;
        this.properties = properties;
        this.executor = executor;
    }

    public BlockTransformResult process(long blockNumber, List<Transaction> transactions) {
        for (Transaction tx : transactions) {
            if (tx.blockNumber() != blockNumber) {
                throw new IllegalArgumentException("Tx " + tx.txHash() + " belongs to block " + tx.blockNumber()
                        + ", not " + blockNumber);
            }
        }
        if (transactions.isEmpty()) {
            log.info("Block {} has no transactions", blockNumber);
            return new BlockTransformResult(blockNumber, List.of());
        }
        int permits = Math.max(1, Math.min(properties.getParallelism(), transactions.size()));
        Semaphore semaphore = new Semaphore(permits);
        List<CompletableFuture<TransformedTransaction>> futures = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            futures.add(CompletableFuture.supplyAsync(() -> transformOne(tx, semaphore), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<TransformedTransaction> results = futures.stream().map(CompletableFuture::join).toList();
        BlockTransformResult result = new BlockTransformResult(blockNumber, results);
        BlockTransformSummary summary = result.summary();
        log.info("Block {} transformed: {} txs ({} processed, {} skipped, {} with errors), {} events, {} positions, {} errors",
                blockNumber, summary.transactions(), summary.processed(), summary.skipped(),
                summary.erroredTransactions(), summary.events(), summary.positions(), summary.errors());
        return result;
    }

    private TransformedTransaction transformOne(Transaction tx, Semaphore semaphore) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting to transform " + tx.txHash(), e);
        }
        try {
            return engine.transform(tx);
        } finally {
            semaphore.release();
        }
    }
}

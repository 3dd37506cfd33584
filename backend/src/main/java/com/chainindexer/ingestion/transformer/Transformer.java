package com.chainindexer.ingestion.transformer;

import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.transform.SignalExtraction;
import com.chainindexer.ingestion.transform.TransformContext;
import com.chainindexer.ingestion.transform.TransformResult;

import java.util.List;

/**
 * Contract-specific reconciliation logic. One instance per configured contract address.
 * Implementations only read the context; the engine merges what they return.
 */
public interface Transformer {

    String contractAddress();

    TransformerType type();

    /**
     * Phase 1: turn this contract's raw movement logs into signals.
     */
    SignalExtraction processTransfers(List<DecodedLog> logs, Transaction tx);

    /**
     * Phase 2: match this contract's higher-level logs against the unmatched signal pool.
     */
    TransformResult processLogs(List<DecodedLog> logs, TransformContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}

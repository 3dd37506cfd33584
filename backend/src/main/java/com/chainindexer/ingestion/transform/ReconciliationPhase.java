package com.chainindexer.ingestion.transform;

/**
 * Lifecycle of one transaction's context: EXTRACTING, then RECONCILING, then FINALIZED.
 */
public enum ReconciliationPhase {
    EXTRACTING,
    RECONCILING,
    FINALIZED
}

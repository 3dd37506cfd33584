package com.chainindexer.domain;

/**
 * Per-log reconciliation failure kinds. None of them aborts a transaction.
 */
public enum ErrorType {
    MISSING_ATTRIBUTES,
    INVALID_LIQUIDITY_DEPOSIT,
    INVALID_LIQUIDITY_WITHDRAWAL,
    INVALID_SWAP,
    PROCESSING_EXCEPTION,
    INVALID_LB_TRANSFER,
    INVALID_FEE_COLLECTION,
    INVALID_STAKING,
    /** Event wanted a transfer another event already matched; the later event is dropped. */
    CONFLICTING_MATCH;

    public String code() {
        return name().toLowerCase();
    }
}

package com.chainindexer.domain;

/**
 * One log of a transaction as delivered by the decoder: either ABI-decoded or left raw.
 */
public interface TransactionLog {

    int index();

    String contract();
}

package com.chainindexer.domain;

/**
 * Intermediate observation extracted from one log in phase 1; keyed by that log's index.
 */
public interface Signal {

    int logIndex();
}

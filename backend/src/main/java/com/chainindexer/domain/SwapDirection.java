package com.chainindexer.domain;

public enum SwapDirection {
    BUY,
    SELL
}

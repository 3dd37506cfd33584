package com.chainindexer.domain;

public enum EventType {
    TRANSFER,
    LIQUIDITY,
    POSITION,
    POOL_SWAP,
    TRADE,
    REWARD,
    STAKING,
    FEE
}

package com.chainindexer.domain;

public enum TradeType {
    TRADE,
    ARBITRAGE,
    AUCTION
}

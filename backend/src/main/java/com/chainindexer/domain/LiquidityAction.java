package com.chainindexer.domain;

public enum LiquidityAction {
    ADD_LP,
    REMOVE_LP,
    UPDATE_LP
}

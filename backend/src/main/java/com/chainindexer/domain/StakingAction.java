package com.chainindexer.domain;

public enum StakingAction {
    DEPOSIT,
    WITHDRAW
}

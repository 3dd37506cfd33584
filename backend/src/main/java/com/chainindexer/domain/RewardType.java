package com.chainindexer.domain;

public enum RewardType {
    CLAIM_FEES,
    CLAIM_REWARDS
}

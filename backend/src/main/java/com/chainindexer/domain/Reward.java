package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record Reward(
        Instant timestamp,
        String txHash,
        int logIndex,
        String contract,
        String recipient,
        String token,
        BigInteger amount,
        RewardType rewardType,
        Map<String, MatchedTransfer> transfers
) implements DomainEvent {

    public Reward {
        transfers = Map.copyOf(transfers);
    }

    @Override
    public EventType eventType() {
        return EventType.REWARD;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "reward");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("contract", contract);
        fields.put("recipient", recipient);
        fields.put("token", token);
        fields.put("amount", amount);
        fields.put("reward_type", rewardType);
        return fields;
    }
}

package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stake or unstake of {@code token} into a wrapper or farm. {@code receiptToken} is null when the
 * contract issues no receipt (farms).
 */
public record Staking(
        Instant timestamp,
        String txHash,
        int logIndex,
        String contract,
        String staker,
        String token,
        BigInteger amount,
        String receiptToken,
        BigInteger amountReceipt,
        StakingAction action,
        Map<String, MatchedTransfer> transfers
) implements DomainEvent {

    public Staking {
        transfers = Map.copyOf(transfers);
    }

    @Override
    public EventType eventType() {
        return EventType.STAKING;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "staking");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("contract", contract);
        fields.put("staker", staker);
        fields.put("token", token);
        fields.put("amount", amount);
        fields.put("action", action);
        return fields;
    }
}

package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fee charged by a pool, reported separately from the swap amount it was charged on.
 */
public record Fee(
        Instant timestamp,
        String txHash,
        int logIndex,
        String contract,
        String payer,
        String token,
        BigInteger amount
) implements DomainEvent {

    @Override
    public EventType eventType() {
        return EventType.FEE;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "fee");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("contract", contract);
        fields.put("payer", payer);
        fields.put("token", token);
        fields.put("amount", amount);
        return fields;
    }
}

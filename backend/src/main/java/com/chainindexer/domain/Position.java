package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Balance change of one receipt id (a bin for bin pools, 0 for fungible LP tokens).
 * Amounts are signed: negative on withdrawal.
 */
public record Position(
        Instant timestamp,
        String txHash,
        int logIndex,
        String pool,
        String provider,
        String receiptToken,
        BigInteger receiptId,
        BigInteger amountBase,
        BigInteger amountQuote,
        BigInteger amountReceipt
) implements DomainEvent {

    @Override
    public EventType eventType() {
        return EventType.POSITION;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "position");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("pool", pool);
        fields.put("provider", provider);
        fields.put("receipt_token", receiptToken);
        fields.put("receipt_id", receiptId);
        fields.put("amount_base", amountBase);
        fields.put("amount_quote", amountQuote);
        fields.put("amount_receipt", amountReceipt);
        return fields;
    }
}

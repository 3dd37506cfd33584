package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liquidity added to or removed from a pool. Amounts are signed (negative for removals) and always equal
 * the sum of the per-receipt-id {@link #positions()}.
 */
public record Liquidity(
        Instant timestamp,
        String txHash,
        int logIndex,
        String pool,
        String provider,
        String baseToken,
        BigInteger amountBase,
        String quoteToken,
        BigInteger amountQuote,
        String receiptToken,
        BigInteger amountReceipt,
        LiquidityAction action,
        List<Position> positions,
        Map<String, MatchedTransfer> transfers
) implements DomainEvent {

    public Liquidity {
        positions = List.copyOf(positions);
        transfers = Map.copyOf(transfers);
    }

    @Override
    public EventType eventType() {
        return EventType.LIQUIDITY;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "liquidity");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("pool", pool);
        fields.put("provider", provider);
        fields.put("amount_base", amountBase);
        fields.put("amount_quote", amountQuote);
        fields.put("action", action);
        return fields;
    }
}

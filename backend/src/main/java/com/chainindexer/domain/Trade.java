package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User-level trade: a routed trade over one or more pool swaps, an arbitrage loop, or an auction purchase.
 */
public record Trade(
        Instant timestamp,
        String txHash,
        int logIndex,
        String taker,
        SwapDirection direction,
        String baseToken,
        BigInteger baseAmount,
        String quoteToken,
        BigInteger quoteAmount,
        TradeType tradeType,
        List<PoolSwap> swaps,
        Map<String, MatchedTransfer> transfers
) implements DomainEvent {

    public Trade {
        swaps = List.copyOf(swaps);
        transfers = Map.copyOf(transfers);
    }

    @Override
    public EventType eventType() {
        return EventType.TRADE;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "trade");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("taker", taker);
        fields.put("direction", direction);
        fields.put("base_token", baseToken);
        fields.put("base_amount", baseAmount);
        fields.put("quote_token", quoteToken);
        fields.put("quote_amount", quoteAmount);
        fields.put("trade_type", tradeType);
        return fields;
    }
}

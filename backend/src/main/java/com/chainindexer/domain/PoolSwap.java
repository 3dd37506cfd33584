package com.chainindexer.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Swap executed by a single pool. Amounts are absolute; {@code direction} is taken from the sign of the
 * pool's net base delta. Bin pools fill {@code bins} with the per-bin deltas.
 */
public record PoolSwap(
        Instant timestamp,
        String txHash,
        int logIndex,
        String pool,
        String taker,
        SwapDirection direction,
        String baseToken,
        BigInteger baseAmount,
        String quoteToken,
        BigInteger quoteAmount,
        Map<BigInteger, BinAmounts> bins,
        Map<String, MatchedTransfer> transfers
) implements DomainEvent {

    public PoolSwap {
        bins = bins == null ? Map.of() : Map.copyOf(bins);
        transfers = Map.copyOf(transfers);
    }

    @Override
    public EventType eventType() {
        return EventType.POOL_SWAP;
    }

    @Override
    public Map<String, Object> identifyingFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event_type", "pool_swap");
        fields.put("tx_hash", txHash);
        fields.put("log_index", logIndex);
        fields.put("pool", pool);
        fields.put("taker", taker);
        fields.put("direction", direction);
        fields.put("base_amount", baseAmount);
        fields.put("quote_amount", quoteAmount);
        return fields;
    }
}

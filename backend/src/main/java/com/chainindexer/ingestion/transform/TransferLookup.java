package com.chainindexer.ingestion.transform;

import com.chainindexer.domain.TransferSignal;

import java.util.Collections;
import java.util.Map;

/**
 * Transfers seen from one anchor (a contract or a token), split by direction.
 * For a contract anchor the inner key is the token; for a token anchor it is the counterparty address
 * ({@code to} for inbound, {@code from} for outbound). Innermost maps are keyed and ordered by log index.
 */
public record TransferLookup(
        Map<String, Map<Integer, TransferSignal>> in,
        Map<String, Map<Integer, TransferSignal>> out
) {

    public static TransferLookup empty() {
        return new TransferLookup(Map.of(), Map.of());
    }

    public Map<Integer, TransferSignal> in(String key) {
        return in.getOrDefault(key, Collections.emptyMap());
    }

    public Map<Integer, TransferSignal> out(String key) {
        return out.getOrDefault(key, Collections.emptyMap());
    }
}

package com.chainindexer.ingestion.transform;

import com.chainindexer.domain.Signal;
import com.chainindexer.domain.TransferSignal;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Derived lookup over a context's transfer signals. Built once per signal generation and never mutated.
 */
final class TransferIndex {

    private final long generation;
    /** contract address -> {in, out} -> token -> logIndex -> signal */
    private final Map<String, TransferLookup> byContract;
    /** token -> {in, out} -> counterparty -> logIndex -> signal */
    private final Map<String, TransferLookup> byToken;

    private TransferIndex(long generation, Map<String, TransferLookup> byContract, Map<String, TransferLookup> byToken) {
        this.generation = generation;
        this.byContract = byContract;
        this.byToken = byToken;
    }

    static TransferIndex build(long generation, Collection<Signal> signals) {
        Map<String, Mutable> contracts = new HashMap<>();
        Map<String, Mutable> tokens = new HashMap<>();
        for (Signal signal : signals) {
            if (!(signal instanceof TransferSignal transfer)) {
                continue;
            }
            contracts.computeIfAbsent(transfer.toAddress(), k -> new Mutable()).addIn(transfer.token(), transfer);
            contracts.computeIfAbsent(transfer.fromAddress(), k -> new Mutable()).addOut(transfer.token(), transfer);
            Mutable token = tokens.computeIfAbsent(transfer.token(), k -> new Mutable());
            token.addIn(transfer.toAddress(), transfer);
            token.addOut(transfer.fromAddress(), transfer);
        }
        return new TransferIndex(generation, freeze(contracts), freeze(tokens));
    }

    long generation() {
        return generation;
    }

    TransferLookup contract(String address, Set<Integer> excluded) {
        return filter(byContract.get(address), excluded);
    }

    TransferLookup token(String token, Set<Integer> excluded) {
        return filter(byToken.get(token), excluded);
    }

    private static TransferLookup filter(TransferLookup lookup, Set<Integer> excluded) {
        if (lookup == null) {
            return TransferLookup.empty();
        }
        if (excluded.isEmpty()) {
            return lookup;
        }
        Predicate<TransferSignal> keep = t -> !excluded.contains(t.logIndex());
        return new TransferLookup(filterSide(lookup.in(), keep), filterSide(lookup.out(), keep));
    }

    private static Map<String, Map<Integer, TransferSignal>> filterSide(Map<String, Map<Integer, TransferSignal>> side,
                                                                        Predicate<TransferSignal> keep) {
        Map<String, Map<Integer, TransferSignal>> out = new HashMap<>();
        side.forEach((key, byIndex) -> {
            Map<Integer, TransferSignal> kept = new TreeMap<>();
            byIndex.forEach((index, transfer) -> {
                if (keep.test(transfer)) {
                    kept.put(index, transfer);
                }
            });
            if (!kept.isEmpty()) {
                out.put(key, Collections.unmodifiableMap(kept));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, TransferLookup> freeze(Map<String, Mutable> source) {
        Map<String, TransferLookup> out = new HashMap<>();
        source.forEach((key, mutable) -> out.put(key, mutable.freeze()));
        return Collections.unmodifiableMap(out);
    }

    private static final class Mutable {
        private final Map<String, Map<Integer, TransferSignal>> in = new HashMap<>();
        private final Map<String, Map<Integer, TransferSignal>> out = new HashMap<>();

        void addIn(String key, TransferSignal transfer) {
            in.computeIfAbsent(key, k -> new TreeMap<>()).put(transfer.logIndex(), transfer);
        }

        void addOut(String key, TransferSignal transfer) {
            out.computeIfAbsent(key, k -> new TreeMap<>()).put(transfer.logIndex(), transfer);
        }

        TransferLookup freeze() {
            return new TransferLookup(frozen(in), frozen(out));
        }

        private static Map<String, Map<Integer, TransferSignal>> frozen(Map<String, Map<Integer, TransferSignal>> side) {
            Map<String, Map<Integer, TransferSignal>> copy = new HashMap<>();
            side.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(v)));
            return Collections.unmodifiableMap(copy);
        }
    }
}

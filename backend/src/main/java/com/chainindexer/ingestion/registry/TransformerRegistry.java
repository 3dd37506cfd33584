package com.chainindexer.ingestion.registry;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.domain.DecodedLog;
import com.chainindexer.domain.Transaction;
import com.chainindexer.ingestion.transformer.Transformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Contract address to transformer, plus the priorities that fix dispatch order. Filled once at start-up and
 * read concurrently afterwards.
 * <p>
 * Ordered views group a transaction's logs as priority (ascending) to contract (ascending address) to logs
 * (ascending index), so dispatch never depends on how the log array happened to be ordered.
 */
public class TransformerRegistry {

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public record Registration(Transformer transformer, Map<String, Integer> transferPriorities,
                               Map<String, Integer> logPriorities) {
    }

    public void registerContract(String address, Transformer transformer, Map<String, Integer> transferPriorities,
                                 Map<String, Integer> logPriorities) {
        Objects.requireNonNull(transformer, "transformer");
        String key = EvmAddresses.normalize(address);
        if (key == null || !key.equals(transformer.contractAddress())) {
            throw new IllegalArgumentException("Transformer for " + transformer.contractAddress()
                    + " registered under " + address);
        }
        Registration registration = new Registration(transformer, Map.copyOf(transferPriorities), Map.copyOf(logPriorities));
        if (registrations.putIfAbsent(key, registration) != null) {
            throw new IllegalArgumentException("Contract " + key + " is already registered");
        }
    }

    public Optional<Transformer> transformerFor(String address) {
        return Optional.ofNullable(registrations.get(EvmAddresses.normalize(address))).map(Registration::transformer);
    }

    public Map<String, Registration> registrations() {
        return Collections.unmodifiableMap(registrations);
    }

    public int size() {
        return registrations.size();
    }

    public SortedMap<Integer, Map<String, List<DecodedLog>>> getTransfersOrdered(Transaction tx) {
        return ordered(tx, Registration::transferPriorities);
    }

    public SortedMap<Integer, Map<String, List<DecodedLog>>> getRemainingLogsOrdered(Transaction tx) {
        return ordered(tx, Registration::logPriorities);
    }

    private SortedMap<Integer, Map<String, List<DecodedLog>>> ordered(
            Transaction tx, Function<Registration, Map<String, Integer>> priorities) {
        TreeMap<Integer, TreeMap<String, List<DecodedLog>>> grouped = new TreeMap<>();
        for (DecodedLog log : tx.decodedLogs()) {
            Registration registration = registrations.get(log.contract());
            if (registration == null) {
                continue;
            }
            Integer priority = priorities.apply(registration).get(log.name());
            if (priority == null) {
                continue;
            }
            grouped.computeIfAbsent(priority, p -> new TreeMap<>())
                    .computeIfAbsent(log.contract(), c -> new ArrayList<>())
                    .add(log);
        }
        TreeMap<Integer, Map<String, List<DecodedLog>>> out = new TreeMap<>();
        grouped.forEach((priority, byContract) -> {
            Map<String, List<DecodedLog>> contracts = new LinkedHashMap<>();
            byContract.forEach((contract, logs) -> contracts.put(contract, List.copyOf(logs)));
            out.put(priority, Collections.unmodifiableMap(contracts));
        });
        return Collections.unmodifiableSortedMap(out);
    }
}

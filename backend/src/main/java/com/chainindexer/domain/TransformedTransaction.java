package com.chainindexer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable result of transforming one transaction; what the persistence layer upserts.
 */
public record TransformedTransaction(
        Transaction transaction,
        Map<Integer, Signal> signals,
        Map<String, DomainEvent> events,
        Map<String, Position> positions,
        Map<String, ProcessingError> errors
) {

    public TransformedTransaction {
        signals = Collections.unmodifiableMap(new TreeMap<>(signals));
        events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static TransformedTransaction passThrough(Transaction transaction, Map<String, ProcessingError> errors) {
        return new TransformedTransaction(transaction, Map.of(), Map.of(), Map.of(), errors);
    }

    public String txHash() {
        return transaction.txHash();
    }

    public <T extends DomainEvent> List<T> eventsOfType(Class<T> type) {
        return events.values().stream().filter(type::isInstance).map(type::cast).toList();
    }
}

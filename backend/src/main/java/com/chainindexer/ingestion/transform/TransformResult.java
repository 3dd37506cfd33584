package com.chainindexer.ingestion.transform;

import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.MatchedTransfer;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.ProcessingError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Phase-2 output of one transformer for one contract. The engine merges it into the context in one step.
 */
public record TransformResult(
        Map<Integer, MatchedTransfer> matchedTransfers,
        Map<String, DomainEvent> events,
        Map<String, Position> positions,
        Map<String, ProcessingError> errors,
        Set<Integer> consumedSignals,
        Set<String> removedEventIds
) {

    public TransformResult {
        matchedTransfers = Collections.unmodifiableMap(new TreeMap<>(matchedTransfers));
        events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        consumedSignals = Collections.unmodifiableSet(new LinkedHashSet<>(consumedSignals));
        removedEventIds = Collections.unmodifiableSet(new LinkedHashSet<>(removedEventIds));
    }

    public static TransformResult empty() {
        return builder().build();
    }

    public static TransformResult errorsOnly(Map<String, ProcessingError> errors) {
        Builder builder = builder();
        errors.values().forEach(builder::error);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, MatchedTransfer> matchedTransfers = new TreeMap<>();
        private final Map<String, DomainEvent> events = new LinkedHashMap<>();
        private final Map<String, Position> positions = new LinkedHashMap<>();
        private final Map<String, ProcessingError> errors = new LinkedHashMap<>();
        private final Set<Integer> consumedSignals = new LinkedHashSet<>();
        private final Set<String> removedEventIds = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder matched(MatchedTransfer transfer) {
            matchedTransfers.put(transfer.logIndex(), transfer);
            return this;
        }

        public Builder event(DomainEvent event) {
            events.put(event.contentId(), event);
            return this;
        }

        public Builder position(Position position) {
            positions.put(position.contentId(), position);
            return this;
        }

        public Builder error(ProcessingError error) {
            errors.put(error.errorId(), error);
            return this;
        }

        public Builder consumed(int logIndex) {
            consumedSignals.add(logIndex);
            return this;
        }

        public Builder removed(String eventId) {
            removedEventIds.add(eventId);
            return this;
        }

        public TransformResult build() {
            return new TransformResult(matchedTransfers, events, positions, errors, consumedSignals, removedEventIds);
        }
    }
}

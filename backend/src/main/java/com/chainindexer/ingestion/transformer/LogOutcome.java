package com.chainindexer.ingestion.transformer;

import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.MatchedTransfer;
import com.chainindexer.domain.Position;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.TransferSignal;
import com.chainindexer.ingestion.transform.TransformResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Phase-2 result for one log (or one group of logs): either everything it matched and produced, or one error.
 * A failed outcome carries no matches, so nothing is consumed for that log.
 */
final class LogOutcome {

    private static final LogOutcome EMPTY = new Builder().build();

    private final List<TransferSignal> matched;
    private final List<DomainEvent> events;
    private final List<Position> positions;
    private final List<Integer> consumedSignals;
    private final List<String> removedEventIds;
    private final ProcessingError error;

    private LogOutcome(Builder builder, ProcessingError error) {
        this.matched = List.copyOf(builder.matched);
        this.events = List.copyOf(builder.events);
        this.positions = List.copyOf(builder.positions);
        this.consumedSignals = List.copyOf(builder.consumedSignals);
        this.removedEventIds = List.copyOf(builder.removedEventIds);
        this.error = error;
    }

    static LogOutcome failure(ProcessingError error) {
        return new LogOutcome(new Builder(), error);
    }

    static LogOutcome empty() {
        return EMPTY;
    }

    static Builder success() {
        return new Builder();
    }

    boolean isFailure() {
        return error != null;
    }

    ProcessingError error() {
        return error;
    }

    List<TransferSignal> matched() {
        return matched;
    }

    List<Integer> consumedSignals() {
        return consumedSignals;
    }

    List<String> removedEventIds() {
        return removedEventIds;
    }

    void applyTo(TransformResult.Builder result, String txHash) {
        matched.forEach(t -> result.matched(MatchedTransfer.promote(t, txHash)));
        events.forEach(result::event);
        positions.forEach(result::position);
        consumedSignals.forEach(result::consumed);
        removedEventIds.forEach(result::removed);
    }

    static final class Builder {
        private final List<TransferSignal> matched = new ArrayList<>();
        private final List<DomainEvent> events = new ArrayList<>();
        private final List<Position> positions = new ArrayList<>();
        private final List<Integer> consumedSignals = new ArrayList<>();
        private final List<String> removedEventIds = new ArrayList<>();

        private Builder() {
        }

        Builder matched(Collection<TransferSignal> transfers) {
            matched.addAll(transfers);
            return this;
        }

        Builder event(DomainEvent event) {
            events.add(event);
            return this;
        }

        Builder position(Position position) {
            positions.add(position);
            return this;
        }

        Builder consumed(int logIndex) {
            consumedSignals.add(logIndex);
            return this;
        }

        Builder removed(String eventId) {
            removedEventIds.add(eventId);
            return this;
        }

        LogOutcome build() {
            return new LogOutcome(this, null);
        }
    }
}
